package app.jira.catalogue;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only mapping from tool id to operation descriptor.
 * <p>
 * Built once from the catalogue and never mutated afterwards, so concurrent lookups need no locking.
 * Cross-operation references (async status tools) are checked at construction time.
 */
public final class OperationRegistry {

    private final Map<String, OperationDescriptor> operations;

    public OperationRegistry(Collection<OperationDescriptor> descriptors) {
        Map<String, OperationDescriptor> byId = new LinkedHashMap<>();
        for (OperationDescriptor descriptor : descriptors) {
            if (byId.putIfAbsent(descriptor.toolId(), descriptor) != null) {
                throw new CatalogueException("Duplicate tool id '%s'".formatted(descriptor.toolId()));
            }
        }
        byId.values().forEach(descriptor -> checkAsyncReference(descriptor, byId));
        this.operations = Collections.unmodifiableMap(byId);
    }

    /**
     * @throws UnknownToolException when no operation is registered under {@code toolId}
     */
    public OperationDescriptor resolve(String toolId) {
        OperationDescriptor descriptor = toolId == null ? null : operations.get(toolId);
        if (descriptor == null) {
            throw new UnknownToolException(toolId);
        }
        return descriptor;
    }

    public Optional<OperationDescriptor> find(String toolId) {
        return Optional.ofNullable(toolId).map(operations::get);
    }

    public Collection<OperationDescriptor> all() {
        return operations.values();
    }

    public int size() {
        return operations.size();
    }

    private static void checkAsyncReference(OperationDescriptor descriptor, Map<String, OperationDescriptor> byId) {
        if (!descriptor.isAsync()) {
            return;
        }
        AsyncTaskSpec task = descriptor.asyncTask();
        OperationDescriptor status = byId.get(task.statusTool());
        if (status == null) {
            throw new CatalogueException("Operation '%s' polls unknown status tool '%s'"
                    .formatted(descriptor.toolId(), task.statusTool()));
        }
        boolean acceptsTaskId = status.parameters().stream()
                .anyMatch(spec -> spec.name().equals(task.taskIdParameter()));
        if (!acceptsTaskId) {
            throw new CatalogueException("Status tool '%s' does not declare parameter '%s' required by '%s'"
                    .formatted(status.toolId(), task.taskIdParameter(), descriptor.toolId()));
        }
        if (status.isAsync()) {
            throw new CatalogueException("Status tool '%s' must not itself be asynchronous".formatted(status.toolId()));
        }
    }
}
