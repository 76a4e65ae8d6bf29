package win.ixuni.b2bridge.driver.b2.handler.version;

import reactor.core.publisher.Mono;
import win.ixuni.b2bridge.core.driver.DriverCapabilities.Capability;
import win.ixuni.b2bridge.core.operation.DriverContext;
import win.ixuni.b2bridge.core.operation.OperationHandler;
import win.ixuni.b2bridge.driver.b2.context.B2DriverContext;
import win.ixuni.b2bridge.driver.b2.model.B2File;
import win.ixuni.b2bridge.driver.b2.operation.HideFileOperation;

import java.util.EnumSet;
import java.util.Set;

public class B2HideFileHandler implements OperationHandler<HideFileOperation, B2File> {

    @Override
    public Mono<B2File> handle(HideFileOperation operation, DriverContext context) {
        B2DriverContext ctx = (B2DriverContext) context;
        return Mono.fromCallable(() -> ctx.getClient().hideObject(operation.getBucketId(), operation.getFileName()));
    }

    @Override
    public Class<HideFileOperation> getOperationType() {
        return HideFileOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.WRITE, Capability.VERSIONING);
    }
}
