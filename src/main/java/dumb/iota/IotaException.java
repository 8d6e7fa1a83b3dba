package dumb.iota;

/** Base of the recoverable input errors: a source text that does not scan or does not parse. */
public abstract class IotaException extends Exception {

    protected IotaException(String message) {
        super(message);
    }

    /** Phase that rejected the input. */
    public abstract Interpreter.Phase phase();
}
