package org.trypticon.fstkit;

import org.trypticon.fstkit.properties.PropertyCache;
import org.trypticon.fstkit.properties.SimplePropertyCache;
import org.trypticon.fstkit.properties.VerifyingPropertyCache;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Process-level settings, built once and handed to whatever needs them.
 * Instances are immutable; use {@link #builder()} or {@link #toBuilder()} to make new ones.
 */
public final class FstConfig {

    /**
     * System property holding the default read mode, {@code "read"} or {@code "map"}.
     */
    public static final String READ_MODE_PROPERTY = "fstkit.read_mode";

    /**
     * System property which, when {@code "true"}, verifies cached properties on every query.
     */
    public static final String VERIFY_PROPERTIES_PROPERTY = "fstkit.verify_properties";

    /**
     * System property which, when {@code "true"}, writes aligned data where formats support it.
     */
    public static final String ALIGN_PROPERTY = "fstkit.align";

    @Nonnull
    private final FileReadMode readMode;

    private final boolean verifyProperties;
    private final boolean align;

    @Nonnull
    private final InfoStream infoStream;

    @Nullable
    private final FstRegistry registry;

    private FstConfig(Builder builder) {
        this.readMode = builder.readMode;
        this.verifyProperties = builder.verifyProperties;
        this.align = builder.align;
        this.infoStream = builder.infoStream;
        this.registry = builder.registry;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Gets the configuration with every setting at its default.
     *
     * @return the default configuration.
     */
    public static FstConfig defaults() {
        return builder().build();
    }

    /**
     * Resolves the configuration from system properties. An unrecognised read mode
     * is reported to the info stream and treated as {@link FileReadMode#READ}.
     *
     * @param infoStream the info stream for the new configuration.
     * @return the configuration.
     */
    public static FstConfig fromSystemProperties(@Nonnull InfoStream infoStream) {
        return builder()
                .setInfoStream(infoStream)
                .setReadMode(System.getProperty(READ_MODE_PROPERTY, FileReadMode.READ.getValue()))
                .setVerifyProperties(Boolean.getBoolean(VERIFY_PROPERTIES_PROPERTY))
                .setAlign(Boolean.getBoolean(ALIGN_PROPERTY))
                .build();
    }

    public Builder toBuilder() {
        return new Builder()
                .setReadMode(readMode)
                .setVerifyProperties(verifyProperties)
                .setAlign(align)
                .setInfoStream(infoStream)
                .setRegistry(registry);
    }

    @Nonnull
    public FileReadMode getReadMode() {
        return readMode;
    }

    public boolean isVerifyProperties() {
        return verifyProperties;
    }

    public boolean isAlign() {
        return align;
    }

    @Nonnull
    public InfoStream getInfoStream() {
        return infoStream;
    }

    /**
     * Gets the registry used to resolve type names.
     *
     * @return the configured registry, or the default one discovered on the classpath.
     */
    @Nonnull
    public FstRegistry getRegistry() {
        return registry != null ? registry : FstRegistry.getDefault();
    }

    /**
     * Creates a property cache for a new FST, wrapped for verification when that is turned on.
     *
     * @param properties the initial properties.
     * @return the cache.
     */
    public PropertyCache newPropertyCache(long properties) {
        PropertyCache cache = new SimplePropertyCache(properties);
        return verifyProperties ? new VerifyingPropertyCache(cache) : cache;
    }

    /**
     * Creates default read options for a source.
     *
     * @param source the name of the source.
     * @return the options.
     */
    public FstReadOptions readOptions(@Nonnull String source) {
        return new FstReadOptions(source, readMode);
    }

    /**
     * Creates default write options for a destination.
     *
     * @param source the name of the destination.
     * @return the options.
     */
    public FstWriteOptions writeOptions(@Nonnull String source) {
        return new FstWriteOptions(source, align);
    }

    /**
     * Builder for {@link FstConfig}.
     */
    public static final class Builder {
        private FileReadMode readMode = FileReadMode.READ;
        private boolean verifyProperties;
        private boolean align;
        private InfoStream infoStream = InfoStream.NO_OUTPUT;
        private FstRegistry registry;

        private Builder() {
        }

        public Builder setReadMode(@Nonnull FileReadMode readMode) {
            this.readMode = readMode;
            return this;
        }

        /**
         * Sets the read mode from its configuration string, reporting unknown values
         * to the info stream set so far.
         *
         * @param readMode {@code "read"} or {@code "map"}.
         * @return this builder.
         */
        public Builder setReadMode(@Nonnull String readMode) {
            this.readMode = FileReadMode.parse(readMode, infoStream);
            return this;
        }

        public Builder setVerifyProperties(boolean verifyProperties) {
            this.verifyProperties = verifyProperties;
            return this;
        }

        public Builder setAlign(boolean align) {
            this.align = align;
            return this;
        }

        public Builder setInfoStream(@Nonnull InfoStream infoStream) {
            this.infoStream = infoStream;
            return this;
        }

        /**
         * Sets the registry.
         *
         * @param registry the registry, or {@code null} for the default one.
         * @return this builder.
         */
        public Builder setRegistry(@Nullable FstRegistry registry) {
            this.registry = registry;
            return this;
        }

        public FstConfig build() {
            return new FstConfig(this);
        }
    }
}
