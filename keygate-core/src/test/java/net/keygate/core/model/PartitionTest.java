package net.keygate.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PartitionTest {

    @Test
    void from_acceptsNamesAndLabels() {
        assertEquals(Partition.AUTO_ASSIGN, Partition.from("AUTO_ASSIGN"));
        assertEquals(Partition.AUTO_ASSIGN, Partition.from("auto-assign"));
        assertEquals(Partition.USER_REQUESTABLE, Partition.from(" user-requestable "));
        assertEquals(Partition.RESERVED, Partition.from("reserved"));
        assertEquals(Partition.AUTO_ASSIGN, Partition.from("instance_auto_assign"));
    }

    @Test
    void from_rejectsUnknown() {
        assertThrows(IllegalArgumentException.class, () -> Partition.from(null));
        assertThrows(IllegalArgumentException.class, () -> Partition.from(""));
        assertThrows(IllegalArgumentException.class, () -> Partition.from("vip"));
    }

    @Test
    void slotResult_mapsToTerminalStatus() {
        assertEquals(Slot.Status.RELEASED_SUCCESS, SlotResult.from("success").terminalStatus());
        assertEquals(Slot.Status.RELEASED_ERROR, SlotResult.from("ERROR").terminalStatus());
        assertEquals(Slot.Status.REAPED_EXPIRED, SlotResult.from("expired").terminalStatus());
        assertThrows(IllegalArgumentException.class, () -> SlotResult.from("maybe"));
        assertTrue(Slot.Status.UNKNOWN.terminal());
        assertFalse(Slot.Status.GRANTED.terminal());
    }
}
