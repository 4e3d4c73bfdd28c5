package net.kairos.core.error;

public class InvalidTaskDescriptorException extends SchedulingException {
    public InvalidTaskDescriptorException(String message) { super(message); }
    public InvalidTaskDescriptorException(String message, Throwable cause) { super(message, cause); }
}
