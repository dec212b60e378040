package io.memtab.kernel;

import java.util.Comparator;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Ordering policy of a table, fixed when the table is built.
 * <p>
 * {@link Unordered} keeps rows in insertion order; {@link Keyed} keeps them sorted by a
 * comparator, retaining rows that compare equal.
 *
 * @param <R> the row type
 */
public sealed interface Ordering<R> permits Ordering.Unordered, Ordering.Keyed {

    static <R> Ordering<R> unordered() {
        return new Unordered<>();
    }

    static <R> Ordering<R> keyed(Comparator<? super R> comparator) {
        return new Keyed<>(comparator);
    }

    /**
     * Resolve the policy exactly once, typically to pick a storage strategy.
     *
     * @param whenUnordered result factory for {@link Unordered}
     * @param whenKeyed     result factory for {@link Keyed}, given its comparator
     */
    <T> T select(Supplier<? extends T> whenUnordered, Function<Comparator<? super R>, ? extends T> whenKeyed);

    boolean isKeyed();

    record Unordered<R>() implements Ordering<R> {
        @Override
        public <T> T select(Supplier<? extends T> whenUnordered,
                            Function<Comparator<? super R>, ? extends T> whenKeyed) {
            return whenUnordered.get();
        }

        @Override
        public boolean isKeyed() {
            return false;
        }
    }

    record Keyed<R>(Comparator<? super R> comparator) implements Ordering<R> {
        public Keyed {
            if (comparator == null) {
                throw new IllegalArgumentException("comparator required");
            }
        }

        @Override
        public <T> T select(Supplier<? extends T> whenUnordered,
                            Function<Comparator<? super R>, ? extends T> whenKeyed) {
            return whenKeyed.apply(comparator);
        }

        @Override
        public boolean isKeyed() {
            return true;
        }
    }
}
