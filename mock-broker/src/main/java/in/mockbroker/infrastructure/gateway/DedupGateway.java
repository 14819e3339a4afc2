package in.mockbroker.infrastructure.gateway;

import in.mockbroker.application.port.input.ExecutionGateway;
import in.mockbroker.domain.order.Order;
import in.mockbroker.domain.order.OrderValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Idempotency wrapper around any gateway.
 *
 * The first submit() of a clientOrderId is forwarded, later ones are dropped silently.
 * cancel() and close() pass straight through.
 */
public class DedupGateway implements ExecutionGateway {
    private static final Logger log = LoggerFactory.getLogger(DedupGateway.class);

    private final ExecutionGateway delegate;
    private final Set<String> seen = ConcurrentHashMap.newKeySet();

    public DedupGateway(ExecutionGateway delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public void submit(Order order) {
        OrderValidator.validate(order);
        if (!seen.add(order.clientOrderId())) {
            log.debug("[DedupGateway:{}] Duplicate submit dropped", order.clientOrderId());
            return;
        }
        delegate.submit(order);
    }

    @Override
    public void cancel(String clientOrderId) {
        delegate.cancel(clientOrderId);
    }

    @Override
    public void close() {
        delegate.close();
    }

    public int seenCount() {
        return seen.size();
    }
}
