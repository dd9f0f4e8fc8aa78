package com.gnovoa.scheduler.schedule;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The evening's time slots, best first, each with a desirability weight.
 *
 * <p>Weights must be strictly decreasing so that "earlier in the list" always means "more
 * desirable". Debt is measured against the mean weight.
 */
public record SlotPolicy(List<TimeSlot> slots) {

    /** One start hour and how much teams like playing at it (higher is better). */
    public record TimeSlot(int hour, double weight) {}

    public SlotPolicy {
        if (slots == null || slots.isEmpty()) {
            throw new IllegalArgumentException("At least one time slot is required");
        }
        slots = List.copyOf(slots);

        Set<Integer> hours = new HashSet<>();
        for (int i = 0; i < slots.size(); i++) {
            TimeSlot s = slots.get(i);
            if (s.hour() < 0 || s.hour() > 23) {
                throw new IllegalArgumentException("Slot hour must be between 0 and 23, got " + s.hour());
            }
            if (!hours.add(s.hour())) {
                throw new IllegalArgumentException("Duplicate slot hour " + s.hour());
            }
            if (i > 0 && s.weight() >= slots.get(i - 1).weight()) {
                throw new IllegalArgumentException("Slot weights must be strictly decreasing (hour " + s.hour() + ")");
            }
        }
    }

    /** 6pm to 9pm, weighted 4 down to 1. */
    public static SlotPolicy defaults() {
        return new SlotPolicy(List.of(
                new TimeSlot(18, 4),
                new TimeSlot(19, 3),
                new TimeSlot(20, 2),
                new TimeSlot(21, 1)
        ));
    }

    public int size() {
        return slots.size();
    }

    /** Slot at {@code index}, wrapping around when a round needs more slots than exist. */
    public TimeSlot slotAt(int index) {
        return slots.get(index % slots.size());
    }

    public double averageWeight() {
        double sum = 0;
        for (TimeSlot s : slots) sum += s.weight();
        return sum / slots.size();
    }

    public List<Integer> hours() {
        return slots.stream().map(TimeSlot::hour).toList();
    }
}
