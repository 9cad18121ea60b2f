package org.trypticon.fstkit;

import org.apache.lucene.util.NamedSPILoader;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable table resolving the type names found in headers: FST type names to
 * {@link FstCodec}s and arc type names to {@link ArcType}s.
 */
public final class FstRegistry {

    @Nonnull
    private final Map<String, FstCodec> codecs;

    @Nonnull
    private final Map<String, ArcType<?>> arcTypes;

    private FstRegistry(@Nonnull Map<String, FstCodec> codecs, @Nonnull Map<String, ArcType<?>> arcTypes) {
        this.codecs = Collections.unmodifiableMap(codecs);
        this.arcTypes = Collections.unmodifiableMap(arcTypes);
    }

    /**
     * Gets the registry of every codec and arc type listed under {@code META-INF/services}.
     * Discovery happens once, on first use.
     *
     * @return the default registry.
     */
    public static FstRegistry getDefault() {
        return DefaultHolder.INSTANCE;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Finds a codec by FST type name.
     *
     * @param fstType the FST type name.
     * @return the codec. Returns {@code null} if no codec is registered under that name.
     */
    @Nullable
    public FstCodec getCodec(String fstType) {
        return codecs.get(fstType);
    }

    /**
     * Finds an arc type by name.
     *
     * @param arcType the arc type name.
     * @return the arc type. Returns {@code null} if no arc type is registered under that name.
     */
    @Nullable
    public ArcType<?> getArcType(String arcType) {
        return arcTypes.get(arcType);
    }

    public Set<String> getFstTypes() {
        return codecs.keySet();
    }

    public Set<String> getArcTypes() {
        return arcTypes.keySet();
    }

    @Override
    public String toString() {
        return "FstRegistry(fst types=" + getFstTypes() + ", arc types=" + getArcTypes() + ")";
    }

    private static class DefaultHolder {
        @SuppressWarnings("unchecked")
        private static final FstRegistry INSTANCE = new FstRegistry(
                toMap(new NamedSPILoader<>(FstCodec.class)),
                toMap(new NamedSPILoader<>((Class<ArcType<?>>) (Class<?>) ArcType.class)));
    }

    private static <S extends NamedSPILoader.NamedSPI> Map<String, S> toMap(NamedSPILoader<S> loader) {
        Map<String, S> map = new LinkedHashMap<>();
        for (S service : loader) {
            map.put(service.getName(), service);
        }
        return map;
    }

    /**
     * Builder for a registry with an explicit set of types.
     */
    public static final class Builder {
        private final Map<String, FstCodec> codecs = new LinkedHashMap<>();
        private final Map<String, ArcType<?>> arcTypes = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Registers a codec under its FST type name.
         *
         * @param codec the codec.
         * @return this builder.
         * @throws IllegalArgumentException if the name is invalid or already registered.
         */
        public Builder register(@Nonnull FstCodec codec) {
            add(codecs, codec);
            return this;
        }

        public Builder register(@Nonnull ArcType<?> arcType) {
            add(arcTypes, arcType);
            return this;
        }

        private static <S extends NamedSPILoader.NamedSPI> void add(Map<String, S> map, S service) {
            String name = service.getName();
            NamedSPILoader.checkServiceName(name);
            if (map.putIfAbsent(name, service) != null) {
                throw new IllegalArgumentException("Service '" + name + "' registered more than once");
            }
        }

        public FstRegistry build() {
            return new FstRegistry(new LinkedHashMap<>(codecs), new LinkedHashMap<>(arcTypes));
        }
    }
}
