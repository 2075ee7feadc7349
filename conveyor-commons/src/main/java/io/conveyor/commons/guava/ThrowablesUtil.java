package io.conveyor.commons.guava;

import com.google.common.base.Throwables;

public class ThrowablesUtil
{
    private ThrowablesUtil()
    { }

    /**
     * Rethrows an unchecked throwable as is, and wraps anything else in a RuntimeException.
     * Use only where the caller has no meaningful checked exception to declare.
     */
    public static RuntimeException propagate(Throwable throwable)
    {
        Throwables.throwIfUnchecked(throwable);
        throw new RuntimeException(throwable);
    }

    public static <X extends Throwable> void propagateIfInstanceOf(Throwable throwable, Class<X> declaredType)
            throws X
    {
        if (throwable != null) {
            Throwables.throwIfInstanceOf(throwable, declaredType);
        }
    }

    public static void propagateIfPossible(Throwable throwable)
    {
        if (throwable != null) {
            Throwables.throwIfUnchecked(throwable);
        }
    }

    /**
     * Returns a one-line description of a throwable and its causes, suitable for notifications.
     */
    public static String describe(Throwable throwable)
    {
        StringBuilder sb = new StringBuilder();
        Throwable t = throwable;
        int depth = 0;
        while (t != null && depth++ < 10) {
            if (sb.length() > 0) {
                sb.append(" caused by ");
            }
            sb.append(t.getClass().getSimpleName());
            if (t.getMessage() != null) {
                sb.append(": ").append(t.getMessage());
            }
            t = t.getCause();
        }
        return sb.toString();
    }
}
