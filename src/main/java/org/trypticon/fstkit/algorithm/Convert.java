package org.trypticon.fstkit.algorithm;

import org.trypticon.fstkit.Fst;
import org.trypticon.fstkit.FstClass;
import org.trypticon.fstkit.FstCodec;
import org.trypticon.fstkit.FstConfig;
import org.trypticon.fstkit.Weight;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Converts an FST to another implementation.
 */
public final class Convert {
    private Convert() {} // no instance

    private static final String COMPONENT = "Convert";

    /**
     * Converts an FST. If it is already of the requested type, it is returned as-is.
     *
     * @param fst the FST.
     * @param fstType the name of the target FST type.
     * @param config the configuration, whose registry resolves the type name.
     * @param <W> the weight type.
     * @return the converted FST. Returns {@code null} if the type name is not registered.
     */
    @Nullable
    public static <W extends Weight> Fst<W> convert(@Nonnull Fst<W> fst, @Nonnull String fstType,
                                                    @Nonnull FstConfig config) {
        if (fst.fstType().equals(fstType)) {
            return fst;
        }
        FstCodec codec = config.getRegistry().getCodec(fstType);
        if (codec == null) {
            config.getInfoStream().message(COMPONENT, "Unknown FST type \"" + fstType + "\"");
            return null;
        }
        return codec.copy(fst, config);
    }

    /**
     * Converts the FST behind a handle.
     *
     * @param fst the handle.
     * @param fstType the name of the target FST type.
     * @return a handle on the converted FST; the same handle if it is already of that type.
     *         Returns {@code null} if the type name is not registered.
     */
    @Nullable
    public static FstClass convert(@Nonnull FstClass fst, @Nonnull String fstType) {
        if (fst.fstType().equals(fstType)) {
            return fst;
        }
        Fst<?> converted = convert(fst.getFst(), fstType, fst.getConfig());
        return converted == null ? null : FstClass.wrap(converted, fst.getConfig());
    }
}
