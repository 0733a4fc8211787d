package dev.fumaz.unbox.reflection;

import org.jetbrains.annotations.NotNull;

import java.lang.reflect.Executable;
import java.util.List;

/**
 * A {@link ParameterIntrospector} turns a constructor or method into the parameter descriptors consumed by the
 * argument resolver.
 */
public interface ParameterIntrospector {

    @NotNull List<ParameterDescriptor> describe(@NotNull Executable executable);

    /**
     * Returns a best-effort description of where the executable is declared, used in diagnostics only.
     */
    @NotNull String locate(@NotNull Executable executable);

}
