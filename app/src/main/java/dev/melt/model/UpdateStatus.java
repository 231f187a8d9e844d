package dev.melt.model;

/**
 * Update-check state of one input: {@code Unknown -> Checking -> UpToDate | Behind(n) | Error(reason)}.
 */
public sealed interface UpdateStatus {

    UpdateStatus UNKNOWN = new Unknown();
    UpdateStatus CHECKING = new Checking();
    UpdateStatus UP_TO_DATE = new UpToDate();

    /** Compact cell text for the list view. */
    String display();

    default boolean isTerminal() {
        return this instanceof UpToDate || this instanceof Behind || this instanceof Error;
    }

    static UpdateStatus fromAheadCount(int count) {
        return count == 0 ? UP_TO_DATE : new Behind(count);
    }

    record Unknown() implements UpdateStatus {
        @Override
        public String display() {
            return "-";
        }
    }

    record Checking() implements UpdateStatus {
        @Override
        public String display() {
            return "...";
        }
    }

    record UpToDate() implements UpdateStatus {
        @Override
        public String display() {
            return "ok";
        }
    }

    record Behind(int count) implements UpdateStatus {
        @Override
        public String display() {
            return "+" + count;
        }
    }

    record Error(String reason) implements UpdateStatus {
        @Override
        public String display() {
            return "?";
        }
    }
}
