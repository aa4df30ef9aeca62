package win.ixuni.splice.test.util;

import reactor.core.publisher.Mono;
import win.ixuni.splice.core.operation.DriverContext;
import win.ixuni.splice.core.operation.HandlerInterceptor;
import win.ixuni.splice.core.operation.InterceptorChain;
import win.ixuni.splice.core.operation.ObjectScoped;
import win.ixuni.splice.core.operation.Operation;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Records every operation that reaches the driver, in call order
 * <p>
 * Entries look like {@code DeleteObject data/a.txt}, or just the operation name for bucket-level calls.
 */
public class OperationRecorder implements HandlerInterceptor {

    private final List<String> calls = new CopyOnWriteArrayList<>();

    @Override
    public <O extends Operation<R>, R> Mono<R> intercept(O operation, DriverContext context,
                                                         InterceptorChain<O, R> chain) {
        return Mono.defer(() -> {
            calls.add(describe(operation));
            return chain.proceed(operation, context);
        });
    }

    private static String describe(Operation<?> operation) {
        if (operation instanceof ObjectScoped scoped) {
            return operation.getOperationName() + " " + scoped.getKey();
        }
        return operation.getOperationName();
    }

    public List<String> calls() {
        return List.copyOf(calls);
    }

    public List<String> calls(String operationName) {
        return calls.stream()
                .filter(call -> call.equals(operationName) || call.startsWith(operationName + " "))
                .toList();
    }

    public void clear() {
        calls.clear();
    }

    @Override
    public int getOrder() {
        return -200;
    }
}
