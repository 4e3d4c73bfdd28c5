package net.kairos.core.error;

public class DuplicateNameException extends SchedulingException {
    private final String namespace;
    private final String name;

    public DuplicateNameException(String namespace, String name) {
        this(namespace, name, null);
    }

    public DuplicateNameException(String namespace, String name, Throwable cause) {
        super("job name already exists: " + namespace + "/" + name, cause);
        this.namespace = namespace;
        this.name = name;
    }

    public String getNamespace() { return namespace; }

    public String getName() { return name; }
}
