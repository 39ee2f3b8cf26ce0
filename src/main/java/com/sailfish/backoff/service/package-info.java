/**
 * Entry points of the backoff executor: {@link com.sailfish.backoff.service.BackoffExecutionService}
 * and its convenience wrappers.
 */
package com.sailfish.backoff.service;
