package com.astrophot.workflow;

import com.astrophot.model.AnchorMissingException;
import com.astrophot.model.ApertureParams;
import com.astrophot.model.FailureKind;
import com.astrophot.model.FrameFailure;
import com.astrophot.model.PhotometryResult;
import com.astrophot.model.Position;
import com.astrophot.model.SessionReport;
import com.astrophot.model.SessionSettings;
import com.astrophot.model.SessionSnapshot;
import com.astrophot.model.WorkflowMode;
import com.astrophot.service.ResultSink;
import com.astrophot.testing.InMemoryFrameSource;
import com.astrophot.testing.StarField;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class WorkflowSessionTest {

    private static final ApertureParams APERTURE = new ApertureParams(6, 9, 13);

    @Mock
    private ResultSink sink;

    private static SessionSettings settings(boolean autoTracking) {
        return new SessionSettings("Algol", APERTURE, 15, autoTracking);
    }

    private static List<Integer> frameIndexes(List<PhotometryResult> results) {
        List<Integer> out = new ArrayList<>();
        for (PhotometryResult r : results) out.add(r.frameIndex);
        return out;
    }

    @Test
    void sequentialTracksAndMeasuresEveryFrame() {
        final var source = InMemoryFrameSource.drifting(5, 20, 30, 2, 1);
        final var session = new WorkflowSession(source, settings(true));

        session.startSequential(new Position(21, 31));

        final var s = session.snapshot();
        assertThat(s.mode).isEqualTo(WorkflowMode.IDLE);
        assertThat(s.currentFrameIndex).isEqualTo(5);
        assertThat(s.results).hasSize(5);
        assertThat(frameIndexes(s.results)).containsExactly(0, 1, 2, 3, 4);
        for (int i = 0; i < 5; i++) {
            assertThat(s.positions.get(i).x).isCloseTo(20 + 2 * i, within(0.05));
            assertThat(s.positions.get(i).y).isCloseTo(30 + i, within(0.05));
        }
        assertThat(s.results.get(0).movement).isZero();
        assertThat(s.results.get(3).movement).isCloseTo(Math.sqrt(5), within(0.05));
        assertThat(s.results.get(2).starName).isEqualTo("Algol");
        assertThat(s.results.get(2).fileName).isEqualTo("frame_003.fits");
        assertThat(s.results.get(2).metadata).containsEntry("fits_object", "TEST");
        assertThat(s.failures).isEmpty();
    }

    @Test
    void manualModeAsksForEveryFrameAfterTheFirst() {
        final var source = InMemoryFrameSource.drifting(3, 20, 30, 2, 0);
        final var session = new WorkflowSession(source, settings(false));
        final List<PendingDecision> asked = new ArrayList<>();
        session.setListener(new SessionListener() {
            @Override
            public void onDecisionRequired(PendingDecision decision) {
                asked.add(decision);
            }
        });

        session.startSequential(new Position(20, 30));

        assertThat(session.snapshot().awaitingDecision).isTrue();
        assertThat(session.pendingDecision()).map(PendingDecision::frameIndex).contains(1);
        assertThat(asked).singleElement().extracting(PendingDecision::reason)
                .isEqualTo(PendingDecision.Reason.POSITION_REQUIRED);

        session.supplyPosition(new Position(22, 30));
        session.supplyPosition(new Position(24, 30));

        final var s = session.snapshot();
        assertThat(s.mode).isEqualTo(WorkflowMode.IDLE);
        assertThat(s.positions).containsExactly(new Position(20, 30), new Position(22, 30), new Position(24, 30));
        assertThat(s.results).hasSize(3);
        assertThat(s.results.get(2).movement).isEqualTo(2.0);
        assertThat(asked).hasSize(2);
    }

    @Test
    void lostStarRaisesDecisionAndKeepsCallerPosition() {
        final var source = new InMemoryFrameSource()
                .add(StarField.starPlane(30, 30))
                .add(StarField.emptyPlane())
                .add(StarField.starPlane(30, 30))
                .add(StarField.starPlane(30, 30));
        final var session = new WorkflowSession(source, settings(true));

        session.startSequential(new Position(31, 29));

        assertThat(session.pendingDecision()).isPresent();
        assertThat(session.pendingDecision().get().reason()).isEqualTo(PendingDecision.Reason.TRACKING_LOST);
        assertThat(session.snapshot().failures).extracting(f -> f.kind)
                .containsExactly(FailureKind.TRACKING_LOST);
        assertThat(session.snapshot().results).hasSize(1);

        session.supplyPosition(new Position(30, 30));

        final var s = session.snapshot();
        assertThat(s.mode).isEqualTo(WorkflowMode.IDLE);
        assertThat(s.positions.get(1)).isEqualTo(new Position(30, 30));
        assertThat(frameIndexes(s.results)).containsExactly(0, 1, 2, 3);
        assertThat(s.positions.get(3).x).isCloseTo(30, within(0.05));
    }

    @Test
    void skipLeavesGapAndContinues() {
        final var source = InMemoryFrameSource.drifting(3, 20, 30, 0, 0);
        final var session = new WorkflowSession(source, settings(false));
        session.startSequential(new Position(20, 30));

        session.skip();
        session.supplyPosition(new Position(20, 30));

        final var s = session.snapshot();
        assertThat(s.positions).containsExactly(new Position(20, 30), null, new Position(20, 30));
        assertThat(frameIndexes(s.results)).containsExactly(0, 2);
    }

    @Test
    void stopDecisionEndsRunKeepingResults() {
        final var source = InMemoryFrameSource.drifting(4, 20, 30, 0, 0);
        final var session = new WorkflowSession(source, settings(false));
        session.startSequential(new Position(20, 30));
        session.supplyPosition(new Position(20, 30));

        session.stop();

        final var s = session.snapshot();
        assertThat(s.mode).isEqualTo(WorkflowMode.IDLE);
        assertThat(s.awaitingDecision).isFalse();
        assertThat(s.results).hasSize(2);
        assertThat(session.pendingDecision()).isEmpty();
    }

    @Test
    void requestStopWhileWaitingEndsRun() {
        final var source = InMemoryFrameSource.drifting(4, 20, 30, 0, 0);
        final var session = new WorkflowSession(source, settings(false));
        session.startSequential(new Position(20, 30));

        session.requestStop();

        assertThat(session.mode()).isEqualTo(WorkflowMode.IDLE);
        assertThat(session.snapshot().results).hasSize(1);
    }

    @Test
    void preSelectionCollectsPositionsWithoutPhotometry() {
        final var source = InMemoryFrameSource.drifting(5, 20, 30, 2, 0);
        final var session = new WorkflowSession(source, settings(true));

        session.startPreSelection(new Position(20, 30));

        final var s = session.snapshot();
        assertThat(s.mode).isEqualTo(WorkflowMode.IDLE);
        assertThat(s.positions).hasSize(5).doesNotContainNull();
        assertThat(s.results).isEmpty();
    }

    @Test
    void batchMeasuresPreselectedPositionsOnce() {
        final var source = InMemoryFrameSource.drifting(5, 20, 30, 2, 0);
        final var session = new WorkflowSession(source, settings(true));
        session.startPreSelection(new Position(20, 30));
        final var loadsBefore = source.loads().size();

        session.startBatch();

        final var s = session.snapshot();
        assertThat(s.mode).isEqualTo(WorkflowMode.IDLE);
        assertThat(frameIndexes(s.results)).containsExactly(0, 1, 2, 3, 4);
        assertThat(s.results.get(1).movement).isCloseTo(2.0, within(0.05));
        assertThat(source.loads().size() - loadsBefore).isEqualTo(5);

        session.startBatch();

        assertThat(session.snapshot().results).hasSize(5);
        assertThat(session.snapshot().results).isEqualTo(s.results);
    }

    @Test
    void batchReplaySkipsMissingPositions() {
        final var source = InMemoryFrameSource.drifting(3, 20, 30, 0, 0);
        final var session = new WorkflowSession(source, settings(false));

        session.seedPositions(Arrays.asList(new Position(20, 30), null, new Position(23, 34), new Position(1, 1)));
        session.startBatch();

        final var s = session.snapshot();
        assertThat(s.positions).hasSize(3);
        assertThat(frameIndexes(s.results)).containsExactly(0, 2);
        assertThat(s.results.get(1).movement).isEqualTo(5.0);
        assertThat(source.loads()).containsExactly(0, 2);
    }

    @Test
    void requestStopDuringBatchIsRestartable() {
        final var source = InMemoryFrameSource.drifting(4, 20, 30, 0, 0);
        final var session = new WorkflowSession(source, settings(false));
        session.seedPositions(List.of(new Position(20, 30), new Position(20, 30), new Position(20, 30),
                new Position(20, 30)));
        session.setListener(new SessionListener() {
            @Override
            public void onProgress(SessionSnapshot snapshot) {
                if (snapshot.results.size() == 2) session.requestStop();
            }
        });

        session.startBatch();
        assertThat(session.mode()).isEqualTo(WorkflowMode.IDLE);
        assertThat(frameIndexes(session.snapshot().results)).containsExactly(0, 1);

        session.setListener(null);
        session.startBatch();
        assertThat(frameIndexes(session.snapshot().results)).containsExactly(0, 1, 2, 3);
    }

    @Test
    void decodeFailureIsRecordedAndSkipped() {
        final var source = new InMemoryFrameSource()
                .add(StarField.starPlane(30, 30))
                .addBroken("checksum")
                .add(StarField.starPlane(31, 30))
                .add(StarField.starPlane(32, 30));
        final var session = new WorkflowSession(source, settings(true));

        session.startSequential(new Position(30, 30));

        final var s = session.snapshot();
        assertThat(s.mode).isEqualTo(WorkflowMode.IDLE);
        assertThat(s.positions.get(1)).isNull();
        assertThat(frameIndexes(s.results)).containsExactly(0, 2, 3);
        assertThat(s.results.get(1).movement).isCloseTo(1.0, within(0.05));
        assertThat(s.failures).singleElement().satisfies(f -> {
            assertThat(f.frameIndex).isEqualTo(1);
            assertThat(f.kind).isEqualTo(FailureKind.FRAME_DECODE_FAILED);
            assertThat(f.message).isEqualTo("checksum");
        });
    }

    @Test
    void batchDecodeFailureIsRecordedWithoutDecision() {
        final var source = new InMemoryFrameSource()
                .add(StarField.starPlane(30, 30))
                .addBroken("checksum")
                .add(StarField.starPlane(30, 30));
        final var session = new WorkflowSession(source, settings(false));
        session.seedPositions(drift(3, 30, 30, 0, 0));

        session.startBatch();

        final var s = session.snapshot();
        assertThat(s.mode).isEqualTo(WorkflowMode.IDLE);
        assertThat(s.awaitingDecision).isFalse();
        assertThat(s.positions.get(1)).isNull();
        assertThat(frameIndexes(s.results)).containsExactly(0, 2);
        assertThat(s.failures).extracting(f -> f.kind).containsExactly(FailureKind.FRAME_DECODE_FAILED);
    }

    @Test
    void missingAnchorIsFatal() {
        final var session = new WorkflowSession(InMemoryFrameSource.drifting(3, 20, 30, 0, 0), settings(true));

        assertThatThrownBy(() -> session.startSequential(null)).isInstanceOf(AnchorMissingException.class);
        assertThat(session.mode()).isEqualTo(WorkflowMode.IDLE);
        assertThat(session.snapshot().failures).extracting(f -> f.kind)
                .containsExactly(FailureKind.ANCHOR_MISSING);
    }

    @Test
    void unreadableFirstFrameIsFatal() {
        final var source = new InMemoryFrameSource().addBroken("truncated").add(StarField.starPlane(30, 30));
        final var session = new WorkflowSession(source, settings(true));

        assertThatThrownBy(() -> session.startPreSelection(new Position(30, 30)))
                .isInstanceOf(AnchorMissingException.class)
                .satisfies(e -> assertThat(((AnchorMissingException) e).getFrameIndex()).isZero());
    }

    @Test
    void batchWithoutPositionsIsFatal() {
        final var session = new WorkflowSession(InMemoryFrameSource.drifting(2, 20, 30, 0, 0), settings(true));

        assertThatThrownBy(session::startBatch).isInstanceOf(AnchorMissingException.class);
    }

    @Test
    void pauseOverwriteTruncatesAndResumeReprocesses() {
        final var source = InMemoryFrameSource.drifting(6, 20, 30, 0, 0);
        final var session = new WorkflowSession(source, settings(false));
        session.startSequential(new Position(20, 30));
        session.supplyPosition(new Position(21, 30));
        session.supplyPosition(new Position(22, 30));
        session.supplyPosition(new Position(23, 30));

        session.requestPause();

        var s = session.snapshot();
        assertThat(s.mode).isEqualTo(WorkflowMode.PAUSED);
        assertThat(s.pausedFromMode).isEqualTo(WorkflowMode.SEQUENTIAL_MANUAL);
        assertThat(s.currentFrameIndex).isEqualTo(4);
        assertThat(s.awaitingDecision).isFalse();

        assertThat(session.navigate(-1)).isEqualTo(3);
        assertThat(session.navigate(-1)).isEqualTo(2);
        assertThat(session.snapshot().positions).hasSize(4);

        session.overwritePosition(2, new Position(25, 31));

        s = session.snapshot();
        assertThat(s.positions).containsExactly(new Position(20, 30), new Position(21, 30), new Position(25, 31));
        assertThat(frameIndexes(s.results)).containsExactly(0, 1, 2);
        assertThat(s.results.get(2).position).isEqualTo(new Position(25, 31));
        assertThat(s.results.get(2).movement).isCloseTo(Math.hypot(4, 1), within(1e-9));
        assertThat(s.currentFrameIndex).isEqualTo(3);
        assertThat(s.mode).isEqualTo(WorkflowMode.PAUSED);

        session.resume();

        assertThat(session.mode()).isEqualTo(WorkflowMode.SEQUENTIAL_MANUAL);
        assertThat(session.pendingDecision()).map(PendingDecision::frameIndex).contains(3);
        session.supplyPosition(new Position(26, 31));
        session.supplyPosition(new Position(27, 31));
        session.supplyPosition(new Position(28, 31));

        s = session.snapshot();
        assertThat(s.mode).isEqualTo(WorkflowMode.IDLE);
        assertThat(frameIndexes(s.results)).containsExactly(0, 1, 2, 3, 4, 5);
        assertThat(s.results.size()).isLessThanOrEqualTo(s.positions.size());
    }

    @Test
    void overwriteDuringPreSelectionDoesNotMeasure() {
        final var source = InMemoryFrameSource.drifting(4, 20, 30, 0, 0);
        final var session = new WorkflowSession(source, settings(false));
        session.startPreSelection(new Position(20, 30));
        session.supplyPosition(new Position(20, 30));
        session.requestPause();

        session.overwritePosition(1, new Position(21, 31));

        assertThat(session.snapshot().results).isEmpty();
        assertThat(session.snapshot().positions).containsExactly(new Position(20, 30), new Position(21, 31));
    }

    @Test
    void overwriteIsRefinedWhenAutoTrackingIsOn() {
        final var source = new InMemoryFrameSource()
                .add(StarField.starPlane(30, 30))
                .add(StarField.emptyPlane())
                .add(StarField.starPlane(32, 30));
        final var session = new WorkflowSession(source, settings(true));
        session.startSequential(new Position(30, 30));
        session.requestPause();

        session.overwritePosition(0, new Position(28, 31));

        final var p = session.snapshot().positions.get(0);
        assertThat(p.x).isCloseTo(30, within(0.05));
        assertThat(p.y).isCloseTo(30, within(0.05));
    }

    private static List<Position> drift(int count, double x0, double y0, double dx, double dy) {
        List<Position> out = new ArrayList<>();
        for (int i = 0; i < count; i++) out.add(new Position(x0 + i * dx, y0 + i * dy));
        return out;
    }

    private static void pauseAfterResults(WorkflowSession session, int count) {
        session.setListener(new SessionListener() {
            @Override
            public void onProgress(SessionSnapshot snapshot) {
                if (snapshot.results.size() == count && snapshot.mode.isActive()) session.requestPause();
            }
        });
    }

    @Test
    void overwriteBeyondBatchCursorIsRejected() {
        final var source = InMemoryFrameSource.drifting(6, 20, 30, 0, 0);
        final var session = new WorkflowSession(source, settings(false));
        session.seedPositions(drift(6, 20, 30, 0, 0));
        pauseAfterResults(session, 2);

        session.startBatch();

        assertThat(session.mode()).isEqualTo(WorkflowMode.PAUSED);
        assertThat(session.snapshot().currentFrameIndex).isEqualTo(2);
        assertThatThrownBy(() -> session.overwritePosition(4, new Position(21, 31)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("4");

        final var s = session.snapshot();
        assertThat(s.positions).hasSize(6);
        assertThat(frameIndexes(s.results)).containsExactly(0, 1);

        session.overwritePosition(2, new Position(21, 31));
        assertThat(frameIndexes(session.snapshot().results)).containsExactly(0, 1, 2);
    }

    @Test
    void resumingBatchAfterOverwriteTracksTheRestAgain() {
        final var source = InMemoryFrameSource.drifting(6, 20, 30, 2, 1);
        final var session = new WorkflowSession(source, settings(true));
        session.seedPositions(drift(6, 20, 30, 2, 1));
        pauseAfterResults(session, 4);
        session.startBatch();
        assertThat(session.snapshot().pausedFromMode).isEqualTo(WorkflowMode.BATCH_AUTOMATIC);
        session.setListener(null);

        session.overwritePosition(1, new Position(23, 30));

        var s = session.snapshot();
        assertThat(s.positions).hasSize(2);
        assertThat(s.positions.get(1).x).isCloseTo(22, within(0.1));
        assertThat(frameIndexes(s.results)).containsExactly(0, 1);

        final var loadsBefore = source.loads().size();
        session.resume();

        s = session.snapshot();
        assertThat(s.mode).isEqualTo(WorkflowMode.IDLE);
        assertThat(frameIndexes(s.results)).containsExactly(0, 1, 2, 3, 4, 5);
        assertThat(s.positions).hasSize(6);
        for (int i = 2; i < 6; i++) {
            assertThat(s.positions.get(i).x).isCloseTo(20 + 2 * i, within(0.1));
            assertThat(s.positions.get(i).y).isCloseTo(30 + i, within(0.1));
        }
        assertThat(source.loads().subList(loadsBefore, source.loads().size())).containsExactly(2, 3, 4, 5);
    }

    @Test
    void batchReacquisitionAsksForPositionsWhenTrackingIsOff() {
        final var source = InMemoryFrameSource.drifting(4, 20, 30, 0, 0);
        final var session = new WorkflowSession(source, settings(false));
        session.seedPositions(drift(4, 20, 30, 0, 0));
        pauseAfterResults(session, 3);
        session.startBatch();
        session.setListener(null);

        session.overwritePosition(1, new Position(21, 30));
        session.resume();

        assertThat(session.mode()).isEqualTo(WorkflowMode.BATCH_AUTOMATIC);
        assertThat(session.pendingDecision()).map(PendingDecision::frameIndex).contains(2);
        session.supplyPosition(new Position(22, 30));
        session.supplyPosition(new Position(23, 30));

        final var s = session.snapshot();
        assertThat(s.mode).isEqualTo(WorkflowMode.IDLE);
        assertThat(s.positions).containsExactly(new Position(20, 30), new Position(21, 30),
                new Position(22, 30), new Position(23, 30));
        assertThat(frameIndexes(s.results)).containsExactly(0, 1, 2, 3);
    }

    @Test
    void overwriteDropsFailuresFromTheTruncatedTail() {
        final var source = new InMemoryFrameSource()
                .add(StarField.starPlane(30, 30))
                .add(StarField.starPlane(31, 30))
                .addBroken("checksum")
                .add(StarField.starPlane(33, 30))
                .add(StarField.starPlane(34, 30));
        final var session = new WorkflowSession(source, settings(true));
        pauseAfterResults(session, 3);
        session.startSequential(new Position(30, 30));
        session.setListener(null);

        assertThat(session.snapshot().currentFrameIndex).isEqualTo(4);
        assertThat(session.snapshot().failures).hasSize(1);

        session.overwritePosition(1, new Position(31, 30));
        assertThat(session.snapshot().failures).isEmpty();
        session.resume();

        final var s = session.snapshot();
        assertThat(frameIndexes(s.results)).containsExactly(0, 1, 3, 4);
        assertThat(s.failures).singleElement().satisfies(f -> {
            assertThat(f.frameIndex).isEqualTo(2);
            assertThat(f.kind).isEqualTo(FailureKind.FRAME_DECODE_FAILED);
        });
    }

    @Test
    void twoSessionsOverTheSamePositionsProduceIdenticalResults() {
        final var positions = drift(5, 20, 30, 2, 1);
        final var first = new WorkflowSession(InMemoryFrameSource.drifting(5, 20, 30, 2, 1), settings(true));
        final var second = new WorkflowSession(InMemoryFrameSource.drifting(5, 20, 30, 2, 1), settings(true));
        first.seedPositions(positions);
        second.seedPositions(positions);

        first.startBatch();
        second.startBatch();

        assertThat(first.snapshot().results).hasSize(5);
        assertThat(second.snapshot().results).isEqualTo(first.snapshot().results);
        assertThat(second.snapshot().positions).isEqualTo(first.snapshot().positions);
    }

    @Test
    void commandsAreCheckedAgainstMode() {
        final var session = new WorkflowSession(InMemoryFrameSource.drifting(2, 20, 30, 0, 0), settings(false));

        assertThatThrownBy(session::resume).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> session.navigate(1)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> session.overwritePosition(0, new Position(1, 1)))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(session::requestPause).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(session::skip).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void finishHandsReportToSinkAndFreezes() throws IOException {
        final var source = InMemoryFrameSource.drifting(3, 20, 30, 1, 0);
        final var session = new WorkflowSession(source, settings(true));
        session.startSequential(new Position(20, 30));

        final var report = session.finish(sink);

        final ArgumentCaptor<SessionReport> captor = ArgumentCaptor.forClass(SessionReport.class);
        verify(sink).accept(captor.capture());
        assertThat(captor.getValue()).isSameAs(report);
        assertThat(report.results).hasSize(3);
        assertThat(report.frameNames).containsExactly("frame_001.fits", "frame_002.fits", "frame_003.fits");
        assertThat(report.settings.starName).isEqualTo("Algol");
        assertThat(session.mode()).isEqualTo(WorkflowMode.COMPLETED);
        assertThatThrownBy(() -> session.finish(sink)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> session.startSequential(new Position(20, 30)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void failingSinkLeavesSessionOpen() throws IOException {
        final var session = new WorkflowSession(InMemoryFrameSource.drifting(2, 20, 30, 0, 0), settings(true));
        session.startSequential(new Position(20, 30));
        doThrow(new IOException("disk full")).when(sink).accept(any());

        assertThatThrownBy(() -> session.finish(sink)).isInstanceOf(IOException.class);
        assertThat(session.mode()).isEqualTo(WorkflowMode.IDLE);
    }
}
