package nibbler.util;

import java.util.function.Supplier;

/**
 * For fields that are evaluated lazily, at most once, also when shared between worker threads
 */
public class Lazy<E> {

    private volatile E element;

    private Supplier<E> supplier;

    public Lazy(Supplier<E> supplier) {
        this.supplier = supplier;
    }

    public E get() {
        E result = element;
        if (result == null) {
            synchronized (this) {
                if (element == null) {
                    element = supplier.get();
                    supplier = null;
                }
                result = element;
            }
        }
        return result;
    }

    public static <E> Lazy<E> l(Supplier<E> supplier) {
        return new Lazy<>(supplier);
    }
}
