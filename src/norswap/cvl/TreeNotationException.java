package norswap.cvl;

/**
 * Thrown by {@link TreeNotation#read(String)} when its input is not a well-formed tree.
 */
public final class TreeNotationException extends RuntimeException
{
    public TreeNotationException (String message) {
        super(message);
    }
}
