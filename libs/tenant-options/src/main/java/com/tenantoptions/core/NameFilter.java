package com.tenantoptions.core;

/**
 * Selects which named instances of an options type a mutator or configure step applies to.
 *
 * <p>Either every name ({@link #all()}) or exactly one name ({@link #named(String)}); the unnamed
 * instance is {@link #defaultName()}.
 *
 * @param name the selected name, or null for every name
 */
public record NameFilter(String name) {

    private static final NameFilter ALL = new NameFilter(null);

    /** Matches every named and unnamed instance. */
    public static NameFilter all() {
        return ALL;
    }

    /**
     * Matches exactly one name.
     *
     * @throws InvalidRegistrationException if name is null
     */
    public static NameFilter named(String name) {
        return new NameFilter(InvalidRegistrationException.requireArgument(name, "name"));
    }

    /** Matches only the unnamed instance. */
    public static NameFilter defaultName() {
        return named(Options.DEFAULT_NAME);
    }

    public boolean matchesAll() {
        return name == null;
    }

    /**
     * Returns true if this filter selects {@code optionsName} (null meaning the default name).
     */
    public boolean matches(String optionsName) {
        return name == null || name.equals(Options.nameOrDefault(optionsName));
    }

    @Override
    public String toString() {
        return name == null ? "NameFilter[*]" : "NameFilter['" + name + "']";
    }
}
