package win.ixuni.b2bridge.driver.b2.handler.version;

import reactor.core.publisher.Mono;
import win.ixuni.b2bridge.core.driver.DriverCapabilities.Capability;
import win.ixuni.b2bridge.core.operation.DriverContext;
import win.ixuni.b2bridge.core.operation.OperationHandler;
import win.ixuni.b2bridge.driver.b2.context.B2DriverContext;
import win.ixuni.b2bridge.driver.b2.model.B2File;
import win.ixuni.b2bridge.driver.b2.operation.GetFileInfoOperation;

import java.util.EnumSet;
import java.util.Set;

public class B2GetFileInfoHandler implements OperationHandler<GetFileInfoOperation, B2File> {

    @Override
    public Mono<B2File> handle(GetFileInfoOperation operation, DriverContext context) {
        B2DriverContext ctx = (B2DriverContext) context;
        return Mono.fromCallable(() -> ctx.getClient().getObject(operation.getFileId()));
    }

    @Override
    public Class<GetFileInfoOperation> getOperationType() {
        return GetFileInfoOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.READ);
    }
}
