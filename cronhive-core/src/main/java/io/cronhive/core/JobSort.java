package io.cronhive.core;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Ordered list of sort keys. Store-agnostic; each store translates it.
 *
 * <p>Null values sort first in ascending order and last in descending order.
 */
public final class JobSort {

    /**
     * Dispatch order: higher priority first, then earliest due.
     */
    public static final JobSort DISPATCH_ORDER = by(Order.desc(JobField.PRIORITY), Order.asc(JobField.NEXT_RUN_AT));

    public static final JobSort NEXT_RUN_ASC = by(Order.asc(JobField.NEXT_RUN_AT));

    public static final JobSort UNSORTED = new JobSort(List.of());

    private final List<Order> orders;

    private JobSort(List<Order> orders) {
        this.orders = List.copyOf(orders);
    }

    public static JobSort by(Order... orders) {
        return new JobSort(List.of(orders));
    }

    public List<Order> orders() {
        return orders;
    }

    public boolean isUnsorted() {
        return orders.isEmpty();
    }

    public JobSort and(Order order) {
        List<Order> next = new ArrayList<>(orders);
        next.add(order);
        return new JobSort(next);
    }

    public Comparator<JobRecord> comparator() {
        Comparator<JobRecord> c = (a, b) -> 0;
        for (Order o : orders) {
            Comparator<Comparable<Object>> values = o.ascending()
                    ? Comparator.nullsFirst(Comparator.<Comparable<Object>>naturalOrder())
                    : Comparator.nullsLast(Comparator.<Comparable<Object>>reverseOrder());
            c = c.thenComparing(o.field()::sortKey, values);
        }
        return c;
    }

    public record Order(JobField field, boolean ascending) {
        public Order {
            Objects.requireNonNull(field, "field must not be null");
            if (!field.isSortable()) {
                throw new IllegalArgumentException("Field is not sortable: " + field.fieldName());
            }
        }

        public static Order asc(JobField field) {
            return new Order(field, true);
        }

        public static Order desc(JobField field) {
            return new Order(field, false);
        }
    }

    @Override
    public String toString() {
        return "JobSort" + orders;
    }
}
