package dev.fumaz.unbox.bind;

/**
 * The lifecycle state of a component name.
 */
public enum ComponentState {

    /**
     * Nothing is known under the name.
     */
    UNREGISTERED,

    /**
     * A factory is registered but has not produced a value yet.
     */
    REGISTERED,

    /**
     * A value is stored, either produced by the factory or injected directly.
     */
    ACTIVE

}
