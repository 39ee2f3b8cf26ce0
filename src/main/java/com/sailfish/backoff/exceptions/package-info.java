/**
 * Exceptions raised or understood by the backoff executor.
 */
package com.sailfish.backoff.exceptions;
