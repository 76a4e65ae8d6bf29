package win.ixuni.b2bridge.driver.b2.context;

import lombok.RequiredArgsConstructor;
import win.ixuni.b2bridge.core.exception.BucketNotFoundException;
import win.ixuni.b2bridge.driver.b2.B2Client;
import win.ixuni.b2bridge.driver.b2.model.B2Bucket;

/**
 * Resolves bucket names to B2 buckets.
 * <p>
 * Every lookup asks B2; bucket ids are not cached across operations.
 */
@RequiredArgsConstructor
public class B2BucketResolver {

    private final B2Client client;

    /**
     * @throws BucketNotFoundException when no bucket has that name
     */
    public B2Bucket resolve(String bucketName) {
        return client.findContainer(bucketName)
                .orElseThrow(() -> new BucketNotFoundException(bucketName));
    }
}
