/**
 * Value types shared by the delay schedule generator and the backoff executor.
 */
package com.sailfish.backoff.model;
