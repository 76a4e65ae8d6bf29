package win.ixuni.b2bridge.driver.b2.interceptor;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.b2bridge.core.exception.BucketAlreadyExistsException;
import win.ixuni.b2bridge.core.exception.BucketNotEmptyException;
import win.ixuni.b2bridge.core.exception.BucketNotFoundException;
import win.ixuni.b2bridge.core.exception.ObjectNotFoundException;
import win.ixuni.b2bridge.core.operation.DriverContext;
import win.ixuni.b2bridge.core.operation.HandlerInterceptor;
import win.ixuni.b2bridge.core.operation.InterceptorChain;
import win.ixuni.b2bridge.core.operation.Operation;
import win.ixuni.b2bridge.core.operation.bucket.CreateBucketOperation;
import win.ixuni.b2bridge.core.operation.bucket.DeleteBucketOperation;
import win.ixuni.b2bridge.core.operation.object.DeleteObjectOperation;
import win.ixuni.b2bridge.core.operation.object.GetObjectOperation;
import win.ixuni.b2bridge.core.operation.object.HeadObjectOperation;
import win.ixuni.b2bridge.core.operation.object.ListObjectsOperation;
import win.ixuni.b2bridge.core.operation.object.PutObjectOperation;
import win.ixuni.b2bridge.driver.b2.exception.B2TransportException;
import win.ixuni.b2bridge.driver.b2.operation.GetFileInfoOperation;
import win.ixuni.b2bridge.driver.b2.operation.HideFileOperation;
import win.ixuni.b2bridge.driver.b2.operation.ListFileVersionsOperation;

/**
 * B2 exception translation interceptor
 * <p>
 * Converts B2 error codes into the core exception hierarchy. The bucket and key come from the
 * operation, since B2 error bodies do not name the resource.
 */
@Slf4j
public class B2ExceptionTranslationInterceptor implements HandlerInterceptor {

    @Override
    public <O extends Operation<R>, R> Mono<R> intercept(
            O operation, DriverContext context, InterceptorChain<O, R> chain) {
        return chain.proceed(operation, context)
                .onErrorMap(B2TransportException.class, e -> translateException(operation, e));
    }

    Throwable translateException(Operation<?> operation, B2TransportException e) {
        String errorCode = e.getB2Code() != null ? e.getB2Code() : "";

        return switch (errorCode) {
            case "not_found" -> notFound(operation, e);
            case "bad_request" -> isFileIdAddressed(operation) ? notFound(operation, e) : passThrough(e);
            case "duplicate_bucket_name" -> new BucketAlreadyExistsException(bucketName(operation));
            case "cannot_delete_non_empty_bucket" -> new BucketNotEmptyException(bucketName(operation));
            default -> passThrough(e);
        };
    }

    /**
     * B2 answers bad_request for any invalid argument; only an unknown file id means not found.
     */
    private static boolean isFileIdAddressed(Operation<?> operation) {
        return operation instanceof GetFileInfoOperation || operation instanceof HideFileOperation;
    }

    private static Throwable passThrough(B2TransportException e) {
        log.debug("Unmapped B2 error code: {} (HTTP {}), passing through", e.getB2Code(), e.getHttpStatus());
        return e;
    }

    private Throwable notFound(Operation<?> operation, B2TransportException e) {
        String key = key(operation);
        if (key != null) {
            return new ObjectNotFoundException(bucketName(operation), key);
        }
        String bucket = bucketName(operation);
        if (bucket != null) {
            return new BucketNotFoundException(bucket);
        }
        return e;
    }

    private static String bucketName(Operation<?> operation) {
        if (operation instanceof CreateBucketOperation op) {
            return op.getBucketName();
        } else if (operation instanceof DeleteBucketOperation op) {
            return op.getBucketName();
        } else if (operation instanceof ListObjectsOperation op) {
            return op.getRequest().getBucketName();
        } else if (operation instanceof PutObjectOperation op) {
            return op.getBucketName();
        } else if (operation instanceof GetObjectOperation op) {
            return op.getBucketName();
        } else if (operation instanceof HeadObjectOperation op) {
            return op.getBucketName();
        } else if (operation instanceof DeleteObjectOperation op) {
            return op.getBucketName();
        } else if (operation instanceof HideFileOperation op) {
            return op.getBucketId();
        } else if (operation instanceof ListFileVersionsOperation op) {
            return op.getBucketId();
        }
        return null;
    }

    private static String key(Operation<?> operation) {
        if (operation instanceof GetObjectOperation op) {
            return op.getKey();
        } else if (operation instanceof HeadObjectOperation op) {
            return op.getKey();
        } else if (operation instanceof DeleteObjectOperation op) {
            return op.getKey();
        } else if (operation instanceof HideFileOperation op) {
            return op.getFileName();
        } else if (operation instanceof GetFileInfoOperation op) {
            return op.getFileId();
        }
        return null;
    }

    @Override
    public int getOrder() {
        // innermost, so the logging interceptor sees the translated exception
        return 100;
    }
}
