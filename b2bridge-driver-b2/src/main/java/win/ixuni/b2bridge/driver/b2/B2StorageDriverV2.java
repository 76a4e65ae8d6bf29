package win.ixuni.b2bridge.driver.b2;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.b2bridge.core.config.DriverConfig;
import win.ixuni.b2bridge.core.driver.AbstractStorageDriverV2;
import win.ixuni.b2bridge.core.operation.DriverContext;
import win.ixuni.b2bridge.core.operation.interceptor.LoggingInterceptor;
import win.ixuni.b2bridge.driver.b2.auth.B2AuthSession;
import win.ixuni.b2bridge.driver.b2.config.B2DriverConfig;
import win.ixuni.b2bridge.driver.b2.context.B2BucketResolver;
import win.ixuni.b2bridge.driver.b2.context.B2DriverContext;
import win.ixuni.b2bridge.driver.b2.handler.bucket.B2CreateBucketHandler;
import win.ixuni.b2bridge.driver.b2.handler.bucket.B2DeleteBucketHandler;
import win.ixuni.b2bridge.driver.b2.handler.bucket.B2ListBucketsHandler;
import win.ixuni.b2bridge.driver.b2.handler.object.B2DeleteObjectHandler;
import win.ixuni.b2bridge.driver.b2.handler.object.B2GetObjectHandler;
import win.ixuni.b2bridge.driver.b2.handler.object.B2HeadObjectHandler;
import win.ixuni.b2bridge.driver.b2.handler.object.B2ListObjectsHandler;
import win.ixuni.b2bridge.driver.b2.handler.object.B2PutObjectHandler;
import win.ixuni.b2bridge.driver.b2.handler.version.B2GetFileInfoHandler;
import win.ixuni.b2bridge.driver.b2.handler.version.B2HideFileHandler;
import win.ixuni.b2bridge.driver.b2.handler.version.B2ListFileVersionsHandler;
import win.ixuni.b2bridge.driver.b2.http.B2RequestRouter;
import win.ixuni.b2bridge.driver.b2.http.B2Transport;
import win.ixuni.b2bridge.driver.b2.http.JdkB2Transport;
import win.ixuni.b2bridge.driver.b2.interceptor.B2ExceptionTranslationInterceptor;
import win.ixuni.b2bridge.driver.b2.mapping.B2ResourceMapper;

/**
 * Backblaze B2 storage driver V2
 * <p>
 * Exposes a B2 account through the uniform bucket/object operations, plus the B2 file version
 * operations. The account is authorized lazily on the first call.
 */
@Slf4j
public class B2StorageDriverV2 extends AbstractStorageDriverV2 {

    @Getter
    private final DriverConfig config;

    private final B2DriverConfig b2Config;

    private final B2Transport transport;

    private final B2DriverContext driverContext;

    public B2StorageDriverV2(DriverConfig config) {
        this(config, B2DriverConfig.from(config));
    }

    B2StorageDriverV2(DriverConfig config, B2DriverConfig b2Config) {
        this(config, b2Config, new JdkB2Transport(b2Config.getConnectTimeout(), b2Config.getRequestTimeout()));
    }

    /**
     * Build a driver on a given transport; tests pass a fake one.
     */
    public B2StorageDriverV2(DriverConfig config, B2DriverConfig b2Config, B2Transport transport) {
        this.config = config;
        this.b2Config = b2Config;
        this.transport = transport;

        B2AuthSession authSession = new B2AuthSession(transport, b2Config);
        B2RequestRouter router = new B2RequestRouter(authSession, transport, b2Config.getScheme());
        B2Client client = new B2Client(router, new B2ResourceMapper(config.getName()),
                b2Config.getDownloadChunkSize());

        this.driverContext = B2DriverContext.builder()
                .config(config)
                .b2Config(b2Config)
                .client(client)
                .bucketResolver(new B2BucketResolver(client))
                .build();

        registerHandlers();
        driverContext.setHandlerRegistry(getHandlerRegistry());
    }

    private void registerHandlers() {
        // Bucket handlers (3)
        getHandlerRegistry().register(new B2ListBucketsHandler());
        getHandlerRegistry().register(new B2CreateBucketHandler());
        getHandlerRegistry().register(new B2DeleteBucketHandler());

        // Object handlers (5)
        getHandlerRegistry().register(new B2ListObjectsHandler());
        getHandlerRegistry().register(new B2PutObjectHandler());
        getHandlerRegistry().register(new B2GetObjectHandler());
        getHandlerRegistry().register(new B2HeadObjectHandler());
        getHandlerRegistry().register(new B2DeleteObjectHandler());

        // File version handlers (3)
        getHandlerRegistry().register(new B2GetFileInfoHandler());
        getHandlerRegistry().register(new B2HideFileHandler());
        getHandlerRegistry().register(new B2ListFileVersionsHandler());

        getHandlerRegistry().addInterceptor(new LoggingInterceptor());
        getHandlerRegistry().addInterceptor(new B2ExceptionTranslationInterceptor());

        log.info("Registered {} operation handlers for B2 driver", getHandlerRegistry().size());
    }

    @Override
    public DriverContext getDriverContext() {
        return driverContext;
    }

    public B2Client getClient() {
        return driverContext.getClient();
    }

    @Override
    public String getDriverType() {
        return B2DriverFactory.DRIVER_TYPE;
    }

    @Override
    public String getDriverName() {
        return config.getName();
    }

    @Override
    public Mono<Void> initialize() {
        log.info("Initializing B2 driver: {} -> {} (key id {})",
                config.getName(), b2Config.getAuthHost(), b2Config.getKeyId());
        return Mono.empty();
    }

    @Override
    public Mono<Void> shutdown() {
        log.info("Shutting down B2 driver: {}", config.getName());
        transport.close();
        return Mono.empty();
    }
}
