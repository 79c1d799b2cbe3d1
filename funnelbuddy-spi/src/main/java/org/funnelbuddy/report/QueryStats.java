package org.funnelbuddy.report;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public class QueryStats {
    public final Integer percentage;
    public final State state;

    @JsonCreator
    public QueryStats(@JsonProperty("percentage") Integer percentage,
                      @JsonProperty("state") State state) {
        this.percentage = percentage;
        this.state = state;
    }

    public enum State {
        /**
         * Query has been accepted and is waiting for a connection.
         */
        QUEUED(false),
        /**
         * Query is running on the event store.
         */
        RUNNING(false),
        /**
         * Query has finished executing and all rows have been consumed.
         */
        FINISHED(true),
        /**
         * Query execution failed.
         */
        FAILED(true);

        private final boolean isDone;

        State(boolean isDone) {
            this.isDone = isDone;
        }

        public boolean isDone() {
            return isDone;
        }
    }
}
