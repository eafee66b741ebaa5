package com.example.pdfrenamer.service.batch;

/**
 * State of the batch. Committing and skipping are transitions between two
 * {@link Displaying} states rather than states of their own, and a commit is
 * only reachable from {@link Displaying}.
 */
public sealed interface BatchState {

    BatchPhase phase();

    record Idle() implements BatchState {
        @Override
        public BatchPhase phase() {
            return BatchPhase.IDLE;
        }
    }

    record Displaying(int index, CurrentDocument document) implements BatchState {
        @Override
        public BatchPhase phase() {
            return BatchPhase.DISPLAYING;
        }
    }

    record Calibrating(int index, CurrentDocument document) implements BatchState {
        @Override
        public BatchPhase phase() {
            return BatchPhase.CALIBRATING;
        }
    }

    record Done(int total) implements BatchState {
        @Override
        public BatchPhase phase() {
            return BatchPhase.DONE;
        }
    }
}
