package com.questrail.killswitch.core;

import com.questrail.killswitch.api.AlarmRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * KillAggregatorTest
 * -----------------------------------------------------------------------------
 * The aggregate follows its members through the bus, so assertions wait on
 * the aggregate record rather than sleeping.
 */
class KillAggregatorTest {

    private static final Duration WAIT = Duration.ofSeconds(2);

    private DefaultAlarmBus bus;
    private AlarmBroadcaster hwKill;
    private AlarmBroadcaster networkLoss;

    @BeforeEach
    void setUp() {
        bus = new DefaultAlarmBus();
        hwKill = new AlarmBroadcaster(bus, AlarmNames.HW_KILL, "estop-driver");
        networkLoss = new AlarmBroadcaster(bus, AlarmNames.NETWORK_LOSS, "watchdog");
    }

    @AfterEach
    void tearDown() {
        bus.close();
    }

    @Test
    void cleanStartDoesNotBroadcast() {
        try (KillAggregator aggregator = KillAggregator.standard(bus)) {
            assertTrue(aggregator.raisedMembers().isEmpty());
            assertEquals(0L, bus.getOrCreate(AlarmNames.KILL).sequence());
        }
    }

    @Test
    void startRaisesWhenMemberAlreadyRaised() {
        networkLoss.raiseAlarm();

        try (KillAggregator aggregator = KillAggregator.standard(bus)) {
            AlarmRecord kill = bus.getOrCreate(AlarmNames.KILL);
            assertTrue(kill.raised());
            assertEquals(AlarmNames.KILL_AGGREGATOR, kill.raisedBy());
            assertEquals(AlarmRecord.MAX_SEVERITY, kill.severity());
            assertEquals(Set.of(AlarmNames.NETWORK_LOSS), aggregator.raisedMembers());
        }
    }

    @Test
    void anyMemberRaisesAndAllMustClear() throws InterruptedException {
        try (KillAggregator aggregator = KillAggregator.standard(bus)) {
            hwKill.raiseAlarm();
            AlarmRecord kill = await(AlarmRecord::raised);
            assertEquals(AlarmNames.HW_KILL, kill.parameters().get("members"));

            networkLoss.raiseAlarm();
            kill = await(r -> r.raised() && r.parameters().get("members").contains(AlarmNames.NETWORK_LOSS));
            assertEquals("hw-kill,network-loss", kill.parameters().get("members"));

            hwKill.clearAlarm();
            kill = await(r -> "network-loss".equals(r.parameters().get("members")));
            assertTrue(kill.raised(), "still raised while network-loss is raised");

            networkLoss.clearAlarm();
            kill = await(r -> !r.raised());
            assertEquals(AlarmNames.KILL_AGGREGATOR, kill.raisedBy());
        }
    }

    @Test
    void repeatedMemberRaiseDoesNotRebroadcast() throws InterruptedException {
        try (KillAggregator aggregator = KillAggregator.standard(bus)) {
            hwKill.raiseAlarm();
            long seq = await(AlarmRecord::raised).sequence();

            hwKill.raiseAlarm();
            hwKill.raiseAlarm();
            // A later change proves the repeats were processed.
            networkLoss.raiseAlarm();
            AlarmRecord kill = await(r -> r.parameters().getOrDefault("members", "").contains(AlarmNames.NETWORK_LOSS));

            assertEquals(seq + 1, kill.sequence());
        }
    }

    @Test
    void forceClearedAggregateIsRaisedAgainByNewMember() throws InterruptedException {
        AlarmAdministration admin = new AlarmAdministration(bus);
        try (KillAggregator aggregator = KillAggregator.standard(bus)) {
            networkLoss.raiseAlarm();
            await(AlarmRecord::raised);

            admin.forceClear(AlarmNames.KILL);
            assertFalse(bus.getOrCreate(AlarmNames.KILL).raised());

            hwKill.raiseAlarm();
            AlarmRecord kill = await(AlarmRecord::raised);
            assertEquals("hw-kill,network-loss", kill.parameters().get("members"));
        }
    }

    @Test
    void memberListIsValidated() {
        assertThrows(IllegalArgumentException.class, () -> new KillAggregator(bus, "kill", List.of()));
        assertThrows(IllegalArgumentException.class, () -> new KillAggregator(bus, "kill", List.of("kill")));
    }

    private AlarmRecord await(java.util.function.Predicate<AlarmRecord> condition) throws InterruptedException {
        Optional<AlarmRecord> record = bus.awaitRecord(AlarmNames.KILL, condition, WAIT);
        assertTrue(record.isPresent(), "kill did not reach the expected state: " + bus.getOrCreate(AlarmNames.KILL));
        return record.get();
    }
}
