package win.ixuni.splice.core.operation;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Operation handler registry
 * <p>
 * Maps operation classes to the handlers of one driver and runs each call through the registered
 * interceptors. Drivers fill it while they are constructed; lookups happen on every operation.
 */
@Slf4j
public class OperationHandlerRegistry {

    private final Map<Class<?>, OperationHandler<?, ?>> handlers = new ConcurrentHashMap<>();
    private final List<HandlerInterceptor> interceptors = new CopyOnWriteArrayList<>();

    public <O extends Operation<R>, R> void register(OperationHandler<O, R> handler) {
        handlers.put(handler.getOperationType(), handler);
        log.debug("Registered handler for operation: {}", handler.getOperationType().getSimpleName());
    }

    /**
     * Add an interceptor, keeping the list sorted by order
     */
    public void addInterceptor(HandlerInterceptor interceptor) {
        List<HandlerInterceptor> sorted = new ArrayList<>(interceptors);
        sorted.add(interceptor);
        sorted.sort(Comparator.comparingInt(HandlerInterceptor::getOrder));
        interceptors.clear();
        interceptors.addAll(sorted);
        log.debug("Added interceptor: {} with order {}",
                interceptor.getClass().getSimpleName(), interceptor.getOrder());
    }

    public void removeInterceptor(HandlerInterceptor interceptor) {
        interceptors.remove(interceptor);
    }

    /**
     * @return the handler, or null when the operation is not supported
     */
    @SuppressWarnings("unchecked")
    public <O extends Operation<R>, R> OperationHandler<O, R> getHandler(Class<O> operationType) {
        return (OperationHandler<O, R>) handlers.get(operationType);
    }

    /**
     * Execute an operation through the interceptor chain
     * <p>
     * Nothing reaches the handler before subscription. Fails with {@link UnsupportedOperationException}
     * when no handler is registered for the operation.
     */
    @SuppressWarnings("unchecked")
    public <O extends Operation<R>, R> Mono<R> execute(O operation, DriverContext context) {
        Class<O> operationType = (Class<O>) operation.getClass();
        OperationHandler<O, R> handler = getHandler(operationType);

        if (handler == null) {
            return Mono.error(new UnsupportedOperationException(
                    "No handler registered for operation: " + operationType.getSimpleName()));
        }

        return Mono.defer(() -> buildChain(handler, 0).proceed(operation, context));
    }

    private <O extends Operation<R>, R> InterceptorChain<O, R> buildChain(OperationHandler<O, R> handler, int index) {
        if (index >= interceptors.size()) {
            return handler::handle;
        }

        HandlerInterceptor interceptor = interceptors.get(index);
        InterceptorChain<O, R> next = buildChain(handler, index + 1);
        return (op, ctx) -> interceptor.intercept(op, ctx, next);
    }

    public boolean supports(Class<? extends Operation<?>> operationType) {
        return handlers.containsKey(operationType);
    }

    public int size() {
        return handlers.size();
    }

    public int interceptorCount() {
        return interceptors.size();
    }
}
