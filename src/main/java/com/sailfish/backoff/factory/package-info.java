/**
 * Method-level decorators: interface proxies that route calls through the backoff executor.
 */
package com.sailfish.backoff.factory;
