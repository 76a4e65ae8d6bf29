package win.ixuni.b2bridge.core.operation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import win.ixuni.b2bridge.core.driver.DriverCapabilities.Capability;
import win.ixuni.b2bridge.core.model.StorageBucket;
import win.ixuni.b2bridge.core.operation.bucket.CreateBucketOperation;
import win.ixuni.b2bridge.core.operation.bucket.DeleteBucketOperation;
import win.ixuni.b2bridge.core.operation.interceptor.LoggingInterceptor;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class OperationHandlerRegistryTest {

    private OperationHandlerRegistry registry;
    private DriverContext context;

    @BeforeEach
    void setUp() {
        registry = new OperationHandlerRegistry();
        context = mock(DriverContext.class);
        when(context.getDriverName()).thenReturn("test");
    }

    @Test
    void executesRegisteredHandler() {
        registry.register(new CreateHandler());

        StorageBucket bucket = registry.execute(new CreateBucketOperation("photos"), context).block();

        assertNotNull(bucket);
        assertEquals("photos", bucket.getName());
        assertTrue(registry.supports(CreateBucketOperation.class));
        assertEquals(1, registry.size());
    }

    @Test
    void missingHandlerFailsWithUnsupportedOperation() {
        Mono<Void> result = registry.execute(new DeleteBucketOperation("photos"), context);

        assertThrows(UnsupportedOperationException.class, result::block);
    }

    @Test
    void interceptorsRunInOrder() {
        List<String> calls = new CopyOnWriteArrayList<>();
        registry.register(new CreateHandler());
        registry.addInterceptor(new RecordingInterceptor("inner", 100, calls));
        registry.addInterceptor(new RecordingInterceptor("outer", -100, calls));
        registry.addInterceptor(new LoggingInterceptor());

        registry.execute(new CreateBucketOperation("photos"), context).block();

        assertEquals(List.of("outer", "inner"), calls);
        assertEquals(3, registry.interceptorCount());
    }

    @Test
    void interceptorCanMapErrors() {
        registry.register(new FailingDeleteHandler());
        registry.addInterceptor(new HandlerInterceptor() {
            @Override
            public <O extends Operation<R>, R> Mono<R> intercept(O operation, DriverContext ctx,
                                                                  InterceptorChain<O, R> chain) {
                return chain.proceed(operation, ctx)
                        .onErrorMap(IllegalStateException.class, e -> new IllegalArgumentException("mapped", e));
            }
        });

        Mono<Void> result = registry.execute(new DeleteBucketOperation("photos"), context);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, result::block);
        assertEquals("mapped", e.getMessage());
    }

    @Test
    void capabilitiesAreUnionOfHandlers() {
        registry.register(new CreateHandler());
        registry.register(new FailingDeleteHandler());

        assertEquals(EnumSet.of(Capability.READ, Capability.WRITE), registry.getAggregatedCapabilities());
    }

    private static class CreateHandler implements OperationHandler<CreateBucketOperation, StorageBucket> {

        @Override
        public Mono<StorageBucket> handle(CreateBucketOperation operation, DriverContext context) {
            return Mono.just(StorageBucket.builder().name(operation.getBucketName()).build());
        }

        @Override
        public Class<CreateBucketOperation> getOperationType() {
            return CreateBucketOperation.class;
        }

        @Override
        public Set<Capability> getProvidedCapabilities() {
            return EnumSet.of(Capability.WRITE);
        }
    }

    private static class FailingDeleteHandler implements OperationHandler<DeleteBucketOperation, Void> {

        @Override
        public Mono<Void> handle(DeleteBucketOperation operation, DriverContext context) {
            return Mono.error(new IllegalStateException("boom"));
        }

        @Override
        public Class<DeleteBucketOperation> getOperationType() {
            return DeleteBucketOperation.class;
        }

        @Override
        public Set<Capability> getProvidedCapabilities() {
            return EnumSet.of(Capability.READ);
        }
    }

    private static class RecordingInterceptor implements HandlerInterceptor {

        private final String name;
        private final int order;
        private final List<String> calls;

        RecordingInterceptor(String name, int order, List<String> calls) {
            this.name = name;
            this.order = order;
            this.calls = calls;
        }

        @Override
        public <O extends Operation<R>, R> Mono<R> intercept(O operation, DriverContext context,
                                                              InterceptorChain<O, R> chain) {
            calls.add(name);
            return chain.proceed(operation, context);
        }

        @Override
        public int getOrder() {
            return order;
        }
    }
}
