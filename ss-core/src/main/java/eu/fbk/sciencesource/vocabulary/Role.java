package eu.fbk.sciencesource.vocabulary;

/**
 * The role of a label: naming a remote property or a remote item.
 */
public enum Role {

    PROPERTY("property"),

    ITEM("item");

    private final String name;

    private Role(final String name) {
        this.name = name;
    }

    @Override
    public String toString() {
        return this.name;
    }

}
