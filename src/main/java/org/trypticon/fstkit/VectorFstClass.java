package org.trypticon.fstkit;

import org.trypticon.fstkit.vector.VectorFst;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Handle on a {@link VectorFst}, for building FSTs whose arc type is chosen at runtime.
 */
public class VectorFstClass extends MutableFstClass {

    private static final String COMPONENT = "VectorFstClass";

    /**
     * Creates a handle on an empty FST.
     *
     * @param arcType the arc type.
     * @param config the configuration.
     */
    public VectorFstClass(@Nonnull ArcType<?> arcType, @Nonnull FstConfig config) {
        super(newFst(arcType, config), config);
    }

    /**
     * Creates a handle on a copy of another FST, of any implementation.
     *
     * @param other the FST to copy.
     */
    public VectorFstClass(@Nonnull FstClass other) {
        super(copyFst(other.getFst(), other.getConfig()), other.getConfig());
    }

    /**
     * Creates a handle on an empty FST, looking up the arc type by name.
     *
     * @param arcType the name of the arc type.
     * @param config the configuration.
     * @return the handle. Returns {@code null} if the arc type is not registered.
     */
    @Nullable
    public static VectorFstClass create(@Nonnull String arcType, @Nonnull FstConfig config) {
        ArcType<?> type = config.getRegistry().getArcType(arcType);
        if (type == null) {
            config.getInfoStream().message(COMPONENT, "Unknown arc type \"" + arcType + "\"");
            return null;
        }
        return new VectorFstClass(type, config);
    }

    private static <W extends Weight> VectorFst<W> newFst(ArcType<W> arcType, FstConfig config) {
        return new VectorFst<>(arcType, config);
    }

    private static <W extends Weight> VectorFst<W> copyFst(Fst<W> fst, FstConfig config) {
        return VectorFst.copyOf(fst, config);
    }
}
