package win.ixuni.b2bridge.driver.b2.handler.version;

import reactor.core.publisher.Mono;
import win.ixuni.b2bridge.core.driver.DriverCapabilities.Capability;
import win.ixuni.b2bridge.core.operation.DriverContext;
import win.ixuni.b2bridge.core.operation.OperationHandler;
import win.ixuni.b2bridge.driver.b2.context.B2DriverContext;
import win.ixuni.b2bridge.driver.b2.model.B2FilePage;
import win.ixuni.b2bridge.driver.b2.operation.ListFileVersionsOperation;

import java.util.EnumSet;
import java.util.Set;

/**
 * B2 list file versions handler, one page per call
 */
public class B2ListFileVersionsHandler implements OperationHandler<ListFileVersionsOperation, B2FilePage> {

    @Override
    public Mono<B2FilePage> handle(ListFileVersionsOperation operation, DriverContext context) {
        B2DriverContext ctx = (B2DriverContext) context;
        return Mono.fromCallable(() -> ctx.getClient().listObjectVersions(
                operation.getBucketId(),
                operation.getStartFileName(),
                operation.getStartFileId(),
                operation.getMaxFileCount()));
    }

    @Override
    public Class<ListFileVersionsOperation> getOperationType() {
        return ListFileVersionsOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.READ, Capability.VERSIONING);
    }
}
