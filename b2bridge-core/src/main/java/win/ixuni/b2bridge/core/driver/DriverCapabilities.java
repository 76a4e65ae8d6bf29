package win.ixuni.b2bridge.core.driver;

import java.util.Set;

/**
 * Driver capability descriptor
 * <p>
 * Lets a driver declare which groups of operations it supports so callers can reject
 * requests up front.
 */
public interface DriverCapabilities {

    enum Capability {
        /**
         * List buckets, list objects, get and head object
         */
        READ,

        /**
         * Create/delete bucket, put and delete object
         */
        WRITE,

        /**
         * Per-object version history (list versions, hide)
         */
        VERSIONING
    }

    /**
     * Get the set of capabilities supported by this driver
     *
     * @return the set of supported capabilities
     */
    Set<Capability> getCapabilities();

    /**
     * Check whether a specific capability is supported
     *
     * @param capability the capability to check
     * @return true if supported
     */
    default boolean supports(Capability capability) {
        return getCapabilities().contains(capability);
    }

    /**
     * Check whether all specified capabilities are supported
     *
     * @param capabilities the capabilities to check
     * @return true if all are supported
     */
    default boolean supportsAll(Capability... capabilities) {
        Set<Capability> caps = getCapabilities();
        for (Capability cap : capabilities) {
            if (!caps.contains(cap)) {
                return false;
            }
        }
        return true;
    }
}
