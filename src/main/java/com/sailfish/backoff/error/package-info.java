/**
 * Error shapes understood by the built-in retryability predicates, and the predicates themselves.
 */
package com.sailfish.backoff.error;
