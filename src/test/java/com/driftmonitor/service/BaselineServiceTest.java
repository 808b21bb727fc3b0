package com.driftmonitor.service;

import com.driftmonitor.entity.ActiveBaselinePointer;
import com.driftmonitor.entity.BaselineSnapshot;
import com.driftmonitor.entity.BaselineStatus;
import com.driftmonitor.exception.BaselineConflictException;
import com.driftmonitor.exception.IllegalStateTransitionException;
import com.driftmonitor.exception.InsufficientSamplesException;
import com.driftmonitor.exception.NoBaselineException;
import com.driftmonitor.repository.ActiveBaselinePointerRepository;
import com.driftmonitor.repository.BaselineSnapshotRepository;
import com.driftmonitor.support.Samples;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BaselineServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    BaselineSnapshotRepository snapshots;

    @Mock
    ActiveBaselinePointerRepository pointers;

    BaselineService service;

    @BeforeEach
    void setUp() {
        service = new BaselineService(snapshots, pointers, Clock.fixed(NOW, ZoneOffset.UTC));
        ReflectionTestUtils.setField(service, "minSamples", 30);
        ReflectionTestUtils.setField(service, "numericBins", 10);
        ReflectionTestUtils.setField(service, "positiveClass", "1");
    }

    @Test
    void createBaseline_firstSnapshotForModel_createsPointer() {
        when(snapshots.maxVersion("credit")).thenReturn(0);
        when(snapshots.save(any(BaselineSnapshot.class))).thenAnswer(inv -> withId(inv.getArgument(0)));
        when(pointers.findById("credit")).thenReturn(Optional.empty());

        var created = service.createBaseline("credit", Samples.regionSplit(100, 0.5), Map.of("source", "q1"), "alice");

        assertThat(created.getVersion()).isEqualTo(1);
        assertThat(created.getStatus()).isEqualTo(BaselineStatus.ACTIVE);
        assertThat(created.getSampleCount()).isEqualTo(100);
        assertThat(created.getSummary().getCategoricalFeatures().get("region"))
            .containsEntry("north", 0.5).containsEntry("south", 0.5);
        assertThat(created.getSummary().getNumericFeatures()).containsKey("age");

        var pointer = ArgumentCaptor.forClass(ActiveBaselinePointer.class);
        verify(pointers).saveAndFlush(pointer.capture());
        assertThat(pointer.getValue().getSnapshotId()).isEqualTo(created.getId());
        assertThat(pointer.getValue().getActivatedAt()).isEqualTo(NOW);
    }

    @Test
    void createBaseline_replacingActiveSnapshot_archivesPrevious() {
        var previous = BaselineSnapshot.builder()
            .id(UUID.randomUUID()).modelId("credit").version(1).status(BaselineStatus.ACTIVE).build();
        var pointer = ActiveBaselinePointer.builder()
            .modelId("credit").snapshotId(previous.getId()).revision(3L).build();
        when(snapshots.maxVersion("credit")).thenReturn(1);
        when(snapshots.save(any(BaselineSnapshot.class))).thenAnswer(inv -> withId(inv.getArgument(0)));
        when(pointers.findById("credit")).thenReturn(Optional.of(pointer));
        when(snapshots.findById(previous.getId())).thenReturn(Optional.of(previous));

        var created = service.createBaseline("credit", Samples.regionSplit(50, 0.9), null, "alice");

        assertThat(created.getVersion()).isEqualTo(2);
        assertThat(previous.getStatus()).isEqualTo(BaselineStatus.ARCHIVED);
        assertThat(previous.getArchivedAt()).isEqualTo(NOW);
        assertThat(pointer.getSnapshotId()).isEqualTo(created.getId());
    }

    @Test
    void createBaseline_tooFewSamples_isRejected() {
        assertThatThrownBy(() -> service.createBaseline("credit", Samples.regionSplit(10, 0.5), null, "alice"))
            .isInstanceOf(InsufficientSamplesException.class);
        verifyNoInteractions(snapshots, pointers);
    }

    @Test
    void createBaseline_concurrentActivation_isAConflict() {
        when(snapshots.maxVersion("credit")).thenReturn(0);
        when(snapshots.save(any(BaselineSnapshot.class))).thenAnswer(inv -> withId(inv.getArgument(0)));
        when(pointers.findById("credit")).thenReturn(Optional.empty());
        when(pointers.saveAndFlush(any())).thenThrow(
            new ObjectOptimisticLockingFailureException(ActiveBaselinePointer.class, "credit"));

        assertThatThrownBy(() -> service.createBaseline("credit", Samples.regionSplit(40, 0.5), null, "alice"))
            .isInstanceOf(BaselineConflictException.class);
    }

    @Test
    void getActiveBaseline_withoutPointer_throwsNoBaseline() {
        when(pointers.findById("unknown")).thenReturn(Optional.empty());
        assertThatThrownBy(() -> service.getActiveBaseline("unknown"))
            .isInstanceOf(NoBaselineException.class);
    }

    @Test
    void archiveBaseline_activeSnapshot_isRejected() {
        var active = BaselineSnapshot.builder()
            .id(UUID.randomUUID()).modelId("credit").status(BaselineStatus.ACTIVE).build();
        when(snapshots.findById(active.getId())).thenReturn(Optional.of(active));
        when(pointers.findById("credit")).thenReturn(Optional.of(
            ActiveBaselinePointer.builder().modelId("credit").snapshotId(active.getId()).build()));

        assertThatThrownBy(() -> service.archiveBaseline(active.getId()))
            .isInstanceOf(IllegalStateTransitionException.class);
        assertThat(active.getStatus()).isEqualTo(BaselineStatus.ACTIVE);
    }

    @Test
    void archiveBaseline_alreadyArchived_isNoOp() {
        var archived = BaselineSnapshot.builder()
            .id(UUID.randomUUID()).modelId("credit").status(BaselineStatus.ARCHIVED).build();
        when(snapshots.findById(archived.getId())).thenReturn(Optional.of(archived));

        assertThat(service.archiveBaseline(archived.getId())).isSameAs(archived);
        verify(snapshots, never()).save(any());
    }

    private static BaselineSnapshot withId(BaselineSnapshot snapshot) {
        if (snapshot.getId() == null) {
            snapshot.setId(UUID.randomUUID());
        }
        return snapshot;
    }
}
