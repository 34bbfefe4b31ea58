package com.vmturbo.placement.common;

import javax.annotation.Nonnull;

/**
 * Thrown when a lookup by UUID finds nothing.
 */
public class ItemNotFoundException extends Exception {
    private static final long serialVersionUID = -3310947126158802071L;

    private ItemNotFoundException(@Nonnull final String message) {
        super(message);
    }

    /**
     * No consumer with the given UUID.
     */
    public static class ConsumerNotFoundException extends ItemNotFoundException {
        private static final long serialVersionUID = 2186346127950722853L;

        /**
         * Constructs an instance of {@link ConsumerNotFoundException}.
         *
         * @param uuid UUID of the missing consumer.
         */
        public ConsumerNotFoundException(@Nonnull final String uuid) {
            super("Consumer " + uuid + " not found.");
        }
    }

    /**
     * No project with the given UUID.
     */
    public static class ProjectNotFoundException extends ItemNotFoundException {
        private static final long serialVersionUID = -8727207403868913770L;

        /**
         * Constructs an instance of {@link ProjectNotFoundException}.
         *
         * @param uuid UUID of the missing project.
         */
        public ProjectNotFoundException(@Nonnull final String uuid) {
            super("Project " + uuid + " not found.");
        }
    }

    /**
     * No user with the given UUID.
     */
    public static class UserNotFoundException extends ItemNotFoundException {
        private static final long serialVersionUID = 5342873513374213870L;

        /**
         * Constructs an instance of {@link UserNotFoundException}.
         *
         * @param uuid UUID of the missing user.
         */
        public UserNotFoundException(@Nonnull final String uuid) {
            super("User " + uuid + " not found.");
        }
    }

    /**
     * No resource provider with the given UUID.
     */
    public static class ResourceProviderNotFoundException extends ItemNotFoundException {
        private static final long serialVersionUID = 1955107834046611934L;

        /**
         * Constructs an instance of {@link ResourceProviderNotFoundException}.
         *
         * @param uuid UUID of the missing resource provider.
         */
        public ResourceProviderNotFoundException(@Nonnull final String uuid) {
            super("Resource provider " + uuid + " not found.");
        }
    }
}
