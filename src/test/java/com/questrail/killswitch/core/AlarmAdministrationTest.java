package com.questrail.killswitch.core;

import com.questrail.killswitch.api.AlarmRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AlarmAdministrationTest {

    private DefaultAlarmBus bus;
    private AlarmAdministration admin;

    @BeforeEach
    void setUp() {
        bus = new DefaultAlarmBus();
        admin = new AlarmAdministration(bus);
    }

    @AfterEach
    void tearDown() {
        bus.close();
    }

    @Test
    void forceClearIsTaggedAsManualOverride() {
        bus.broadcast(AlarmNames.KILL, true, "stuck", Map.of(), "kill-aggregator", 5);

        AlarmRecord cleared = admin.forceClear(AlarmNames.KILL, "operator confirmed link");

        assertFalse(cleared.raised());
        assertEquals(AlarmNames.MANUAL_OVERRIDE, cleared.raisedBy());
        assertEquals("operator confirmed link", cleared.parameters().get("reason"));
        assertEquals(2L, cleared.sequence());
    }

    @Test
    void forceClearOfClearedAlarmStillBroadcasts() {
        AlarmRecord cleared = admin.forceClear(AlarmNames.HW_KILL);

        assertFalse(cleared.raised());
        assertEquals(1L, cleared.sequence());
        assertEquals("operator request", cleared.parameters().get("reason"));
    }

    @Test
    void forceClearDoesNotPreventLaterRaise() {
        admin.forceClear(AlarmNames.NETWORK_LOSS);
        AlarmRecord raised = bus.broadcast(AlarmNames.NETWORK_LOSS, true, null, Map.of(), "watchdog", 5);

        assertTrue(raised.raised());
        assertEquals(2L, raised.sequence());
    }
}
