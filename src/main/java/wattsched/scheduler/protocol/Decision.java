package wattsched.scheduler.protocol;

import wattsched.scheduler.model.PowerState;
import wattsched.scheduler.model.RejectReason;

import java.util.List;
import java.util.Objects;

/**
 * A scheduler decision sent back in reply to a batch.
 */
public interface Decision {

    DecisionType type();

    enum DecisionType {
        EXECUTE_JOB,
        REJECT_JOB,
        SET_RESOURCE_STATE,
        CALL_ME_LATER,
        QUERY
    }

    record ExecuteJob(String jobId, List<Integer> hostIds) implements Decision {
        public ExecuteJob {
            Objects.requireNonNull(jobId, "jobId is required");
            hostIds = List.copyOf(hostIds);
        }

        @Override
        public DecisionType type() {
            return DecisionType.EXECUTE_JOB;
        }
    }

    record RejectJob(String jobId, RejectReason reason) implements Decision {
        @Override
        public DecisionType type() {
            return DecisionType.REJECT_JOB;
        }
    }

    record SetResourceState(List<Integer> hostIds, PowerState target) implements Decision {
        public SetResourceState {
            hostIds = List.copyOf(hostIds);
            if (target != PowerState.IDLE && target != PowerState.SLEEPING) {
                throw new IllegalArgumentException("hosts can only be requested IDLE or SLEEPING, not " + target);
            }
        }

        @Override
        public DecisionType type() {
            return DecisionType.SET_RESOURCE_STATE;
        }
    }

    record CallMeLater(double at) implements Decision {
        @Override
        public DecisionType type() {
            return DecisionType.CALL_ME_LATER;
        }
    }

    record QueryConsumedEnergy() implements Decision {
        @Override
        public DecisionType type() {
            return DecisionType.QUERY;
        }
    }
}
