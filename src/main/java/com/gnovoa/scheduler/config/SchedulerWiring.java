package com.gnovoa.scheduler.config;

import com.gnovoa.scheduler.schedule.RoundDateCalculator;
import com.gnovoa.scheduler.schedule.RoundRobinScheduler;
import com.gnovoa.scheduler.schedule.ScheduleGenerator;
import com.gnovoa.scheduler.schedule.SlotAssigner;
import com.gnovoa.scheduler.schedule.SlotPolicy;
import com.gnovoa.scheduler.standings.StandingsCalculator;
import com.gnovoa.scheduler.store.InMemoryScheduleStore;
import com.gnovoa.scheduler.store.ScheduleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SchedulerWiring {

    private static final Logger log = LoggerFactory.getLogger(SchedulerWiring.class);

    @Bean
    public SlotPolicy slotPolicy(SlotProperties props) {
        SlotPolicy policy = props.toPolicy(); // fails startup on a bad slot table
        log.info("Time slots {} (average weight {})", policy.hours(), policy.averageWeight());
        return policy;
    }

    @Bean
    public RoundRobinScheduler roundRobinScheduler() {
        return new RoundRobinScheduler();
    }

    @Bean
    public RoundDateCalculator roundDateCalculator() {
        return new RoundDateCalculator();
    }

    @Bean
    public SlotAssigner slotAssigner(SlotPolicy policy) {
        return new SlotAssigner(policy);
    }

    @Bean
    public ScheduleGenerator scheduleGenerator(RoundRobinScheduler scheduler, RoundDateCalculator dates, SlotAssigner slots) {
        return new ScheduleGenerator(scheduler, dates, slots);
    }

    @Bean
    public ScheduleStore scheduleStore() {
        return new InMemoryScheduleStore();
    }

    @Bean
    public StandingsCalculator standingsCalculator() {
        return new StandingsCalculator();
    }
}
