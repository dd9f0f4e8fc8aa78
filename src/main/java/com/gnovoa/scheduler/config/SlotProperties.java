package com.gnovoa.scheduler.config;

import com.gnovoa.scheduler.schedule.SlotPolicy;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "schedule")
public record SlotProperties(List<Slot> slots) {
  public record Slot(int hour, double weight) {}

  public SlotProperties {
    if (slots == null) slots = List.of();
  }

  /** Falls back to the 6pm-9pm defaults when nothing is configured. */
  public SlotPolicy toPolicy() {
    if (slots.isEmpty()) return SlotPolicy.defaults();
    return new SlotPolicy(
        slots.stream().map(s -> new SlotPolicy.TimeSlot(s.hour(), s.weight())).toList());
  }
}
