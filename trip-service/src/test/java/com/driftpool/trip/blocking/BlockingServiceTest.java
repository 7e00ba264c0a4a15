package com.driftpool.trip.blocking;

import com.driftpool.shared.enums.BlockReason;
import com.driftpool.trip.entity.UserBlock;
import com.driftpool.trip.exception.TripValidationException;
import com.driftpool.trip.matching.BlockListCache;
import com.driftpool.trip.repository.UserBlockRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BlockingServiceTest {

    @Mock private UserBlockRepository blockRepository;
    @Mock private BlockListCache blockListCache;

    private BlockingService blockingService;

    @BeforeEach
    void setUp() {
        blockingService = new BlockingService(blockRepository, blockListCache);
    }

    private static UserBlock block(String blocker, String blocked) {
        return UserBlock.builder().blockerId(blocker).blockedId(blocked).reasonType(BlockReason.UNCOMFORTABLE).build();
    }

    @Test
    void blockSavesAndEvictsBothUsers() {
        when(blockRepository.findByBlockerIdAndBlockedId("rider-1", "driver-1")).thenReturn(Optional.empty());
        when(blockRepository.save(any(UserBlock.class))).thenAnswer(inv -> inv.getArgument(0));

        UserBlock saved = blockingService.block("rider-1", "driver-1", BlockReason.SAFETY_CONCERN, "unsafe driving");

        assertThat(saved.getReasonType()).isEqualTo(BlockReason.SAFETY_CONCERN);
        verify(blockListCache).evict("rider-1");
        verify(blockListCache).evict("driver-1");
    }

    @Test
    void blockingTwiceKeepsTheFirstRecord() {
        UserBlock existing = block("rider-1", "driver-1");
        when(blockRepository.findByBlockerIdAndBlockedId("rider-1", "driver-1")).thenReturn(Optional.of(existing));

        assertThat(blockingService.block("rider-1", "driver-1", BlockReason.OTHER, null)).isSameAs(existing);
        verify(blockRepository, never()).save(any());
    }

    @Test
    void selfBlockRejected() {
        assertThatThrownBy(() -> blockingService.block("rider-1", "rider-1", BlockReason.OTHER, null))
                .isInstanceOf(TripValidationException.class);
    }

    @Test
    void listBlockedIsMutual() {
        when(blockRepository.findByBlockerId("driver-1")).thenReturn(List.of(block("driver-1", "rider-1")));
        when(blockRepository.findByBlockedId("driver-1")).thenReturn(List.of(block("rider-2", "driver-1")));

        assertThat(blockingService.listBlocked("driver-1")).containsExactlyInAnyOrder("rider-1", "rider-2");
    }

    @Test
    void unblockUnknownPairReturnsFalse() {
        when(blockRepository.findByBlockerIdAndBlockedId("rider-1", "driver-1")).thenReturn(Optional.empty());

        assertThat(blockingService.unblock("rider-1", "driver-1")).isFalse();
        verify(blockRepository, never()).delete(any());
    }
}
