package com.sailfish.backoff.factory;

import com.sailfish.backoff.BackoffOperation;
import com.sailfish.backoff.error.ErrorClassifiers;
import com.sailfish.backoff.retry.BackoffConfig;
import com.sailfish.backoff.retry.RetryListener;
import com.sailfish.backoff.service.BackoffExecutionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Builds interface proxies that route every method call through a {@link BackoffExecutionService}.
 *
 * Methods returning {@link CompletionStage} or {@link CompletableFuture} are retried asynchronously
 * and return the execution's future. Any other method blocks until the execution finishes and
 * either returns the value or rethrows the final error; checked exceptions the method does not
 * declare surface as {@link java.lang.reflect.UndeclaredThrowableException}. {@code equals},
 * {@code hashCode} and {@code toString} are forwarded without retries.
 *
 * Each call of a proxied method is an independent execution with the bound config.
 */
public class BackoffProxyFactory {

    private static final Logger log = LoggerFactory.getLogger(BackoffProxyFactory.class);

    private final BackoffExecutionService executionService;

    public BackoffProxyFactory(BackoffExecutionService executionService) {
        this.executionService = Objects.requireNonNull(executionService, "executionService cannot be null");
    }

    /**
     * Generic decorator: every method of {@code type} is executed with the given config.
     */
    public <I> I withBackoff(Class<I> type, I target, BackoffConfig config) {
        return createProxy(type, target, config);
    }

    public <I> I withNetworkBackoff(Class<I> type, I target) {
        return withNetworkBackoff(type, target, null);
    }

    public <I> I withNetworkBackoff(Class<I> type, I target, RetryListener listener) {
        return createProxy(type, target, BackoffExecutionService.boundConfig(ErrorClassifiers::isNetworkError, listener));
    }

    public <I> I withInternalServerErrorBackoff(Class<I> type, I target) {
        return withInternalServerErrorBackoff(type, target, null);
    }

    public <I> I withInternalServerErrorBackoff(Class<I> type, I target, RetryListener listener) {
        return createProxy(type, target, BackoffExecutionService.boundConfig(ErrorClassifiers::isInternalServerError, listener));
    }

    public <I> I withConnectionErrorMessageBackoff(Class<I> type, I target) {
        return withConnectionErrorMessageBackoff(type, target, null);
    }

    public <I> I withConnectionErrorMessageBackoff(Class<I> type, I target, RetryListener listener) {
        return createProxy(type, target, BackoffExecutionService.boundConfig(ErrorClassifiers::isConnectionErrorMessage, listener));
    }

    private <I> I createProxy(Class<I> type, I target, BackoffConfig config) {
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(target, "target cannot be null");
        Objects.requireNonNull(config, "config cannot be null");
        if (!type.isInterface()) {
            throw new IllegalArgumentException(type.getName() + " is not an interface");
        }
        log.debug("Creating backoff proxy for {} around {}", type.getName(), target.getClass().getName());
        Object proxy = Proxy.newProxyInstance(type.getClassLoader(), new Class<?>[]{type},
                new BackoffInvocationHandler(target, config));
        return type.cast(proxy);
    }

    private final class BackoffInvocationHandler implements InvocationHandler {

        private final Object target;
        private final BackoffConfig config;

        private BackoffInvocationHandler(Object target, BackoffConfig config) {
            this.target = target;
            this.config = config;
        }

        @Override
        public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
            if (method.getDeclaringClass() == Object.class) {
                return invokeTarget(method, args);
            }
            Class<?> returnType = method.getReturnType();
            if (returnType == CompletionStage.class || returnType == CompletableFuture.class) {
                BackoffOperation<Object> operation = () -> {
                    CompletionStage<?> stage = (CompletionStage<?>) invokeTarget(method, args);
                    return stage != null ? stage.thenApply(value -> (Object) value) : null;
                };
                return executionService.executeWithBackoff(operation, config);
            }
            BackoffOperation<Object> operation = BackoffOperation.fromCallable(() -> invokeTarget(method, args));
            return BackoffExecutionService.await(executionService.executeWithBackoff(operation, config));
        }

        private Object invokeTarget(Method method, Object[] args) throws Exception {
            try {
                return method.invoke(target, args);
            } catch (InvocationTargetException e) {
                Throwable cause = e.getCause();
                if (cause instanceof Exception) {
                    throw (Exception) cause;
                }
                if (cause instanceof Error) {
                    throw (Error) cause;
                }
                throw e;
            }
        }
    }
}
