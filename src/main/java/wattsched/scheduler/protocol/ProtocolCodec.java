package wattsched.scheduler.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import wattsched.scheduler.exception.ProtocolException;
import wattsched.scheduler.model.Host;
import wattsched.scheduler.model.Job;
import wattsched.scheduler.model.JobOutcome;
import wattsched.scheduler.model.PowerState;
import wattsched.scheduler.protocol.Decision.CallMeLater;
import wattsched.scheduler.protocol.Decision.ExecuteJob;
import wattsched.scheduler.protocol.Decision.RejectJob;
import wattsched.scheduler.protocol.Decision.SetResourceState;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON codec for the backend protocol.
 *
 * <pre>
 * inbound:  {"now": 12.0, "events": [{"timestamp": 12.0, "type": "JOB_SUBMITTED", "data": {...}}]}
 * outbound: {"now": 12.0, "events": [{"timestamp": 12.0, "type": "EXECUTE_JOB", "data": {...}}]}
 * </pre>
 *
 * Power states are mapped to the backend's pstate identifiers for IDLE and SLEEPING;
 * the remaining states travel under their lowercase names.
 */
public final class ProtocolCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String pstateOn;
    private final String pstateSleep;

    public ProtocolCodec(String pstateOn, String pstateSleep) {
        this.pstateOn = pstateOn;
        this.pstateSleep = pstateSleep;
    }

    /** Codec using plain state names on the wire */
    public static ProtocolCodec withStateNames() {
        return new ProtocolCodec(PowerState.IDLE.wireName(), PowerState.SLEEPING.wireName());
    }

    // ---------- inbound ----------

    public EventBatch decodeBatch(byte[] frame) {
        return decodeBatch(new String(frame, StandardCharsets.UTF_8));
    }

    public EventBatch decodeBatch(String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (IOException e) {
            throw new ProtocolException("malformed batch: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ProtocolException("batch must be a JSON object");
        }
        if (!root.path("now").isNumber()) {
            throw new ProtocolException("batch without numeric 'now'");
        }
        double now = root.path("now").asDouble();

        JsonNode events = root.path("events");
        if (!events.isArray()) {
            throw new ProtocolException("batch without 'events' array");
        }

        List<SchedulerEvent> decoded = new ArrayList<>(events.size());
        for (JsonNode node : events) {
            decoded.add(decodeEvent(node, now));
        }
        return new EventBatch(now, decoded);
    }

    private SchedulerEvent decodeEvent(JsonNode node, double now) {
        String typeName = node.path("type").asText(null);
        if (typeName == null) {
            throw new ProtocolException("event without type: " + node);
        }
        EventType type;
        try {
            type = EventType.valueOf(typeName);
        } catch (IllegalArgumentException e) {
            throw new ProtocolException("unknown event type: " + typeName, e);
        }
        double ts = node.has("timestamp") ? node.path("timestamp").asDouble() : now;
        if (ts > now) {
            throw new ProtocolException(type + " event at " + ts + " is ahead of batch time " + now);
        }
        JsonNode data = node.path("data");

        try {
            return switch (type) {
                case SIMULATION_BEGINS -> new SchedulerEvent.SimulationBegins(ts, decodeTopology(data, ts));
                case JOB_SUBMITTED -> new SchedulerEvent.JobSubmitted(ts, decodeJob(data));
                case JOB_COMPLETED -> new SchedulerEvent.JobCompleted(ts,
                        requireText(data, "job_id"),
                        JobOutcome.fromWire(data.path("job_state").asText(null)),
                        data.path("return_code").asInt(0));
                case JOB_KILLED -> new SchedulerEvent.JobKilled(ts, decodeJobIds(data));
                case RESOURCE_STATE_CHANGED -> new SchedulerEvent.ResourceStateChanged(ts,
                        IntervalSet.parse(requireText(data, "resources")),
                        decodeState(requireText(data, "state")));
                case SIMULATION_ENDS -> new SchedulerEvent.SimulationEnds(ts);
                case REQUESTED_CALL -> new SchedulerEvent.RequestedCall(ts);
                case NOTIFY -> new SchedulerEvent.Notify(ts, requireText(data, "type"));
                case ANSWER -> new SchedulerEvent.EnergyAnswer(ts, requireNumber(data, "consumed_energy"));
            };
        } catch (IllegalArgumentException e) {
            throw new ProtocolException("invalid " + type + " event: " + e.getMessage(), e);
        }
    }

    private List<Host> decodeTopology(JsonNode data, double ts) {
        JsonNode resources = data.path("compute_resources");
        List<Host> hosts = new ArrayList<>();
        if (resources.isArray() && resources.size() > 0) {
            for (JsonNode r : resources) {
                PowerState state = r.has("state") ? decodeState(r.path("state").asText()) : PowerState.IDLE;
                hosts.add(Host.builder()
                        .id(r.path("id").asInt(hosts.size()))
                        .name(r.path("name").asText(null))
                        .capacity(r.path("properties").path("capacity").asInt(1))
                        .powerState(state)
                        .idleSince(state == PowerState.IDLE ? ts : null)
                        .build());
            }
        } else {
            int count = data.path("nb_resources").asInt(0);
            if (count > IntervalSet.MAX_HOST_ID + 1) {
                throw new IllegalArgumentException("nb_resources out of range: " + count);
            }
            for (int i = 0; i < count; i++) {
                hosts.add(Host.builder().id(i).idleSince(ts).build());
            }
        }
        if (hosts.isEmpty()) {
            throw new IllegalArgumentException("topology has no compute resources");
        }
        return hosts;
    }

    private Job decodeJob(JsonNode data) {
        JsonNode job = data.path("job");
        if (!job.isObject()) {
            throw new IllegalArgumentException("missing 'job' description for " + data.path("job_id").asText("?"));
        }
        String id = job.has("id") ? job.path("id").asText() : requireText(data, "job_id");
        return Job.builder()
                .id(id)
                .submissionTime(job.path("subtime").asDouble(0))
                .requestedResources(job.path("res").asInt(0))
                .walltime(job.path("walltime").asDouble(Job.UNLIMITED_WALLTIME))
                .profile(job.path("profile").asText(null))
                .build();
    }

    private List<String> decodeJobIds(JsonNode data) {
        JsonNode ids = data.path("job_ids");
        if (!ids.isArray()) {
            throw new IllegalArgumentException("missing 'job_ids' array");
        }
        List<String> result = new ArrayList<>(ids.size());
        ids.forEach(n -> result.add(n.asText()));
        return result;
    }

    PowerState decodeState(String wire) {
        if (pstateOn.equals(wire)) {
            return PowerState.IDLE;
        }
        if (pstateSleep.equals(wire)) {
            return PowerState.SLEEPING;
        }
        return PowerState.fromWire(wire);
    }

    String encodeState(PowerState state) {
        return switch (state) {
            case IDLE -> pstateOn;
            case SLEEPING -> pstateSleep;
            default -> state.wireName();
        };
    }

    private static String requireText(JsonNode data, String field) {
        JsonNode v = data.path(field);
        if (v.isMissingNode() || v.isNull() || v.asText().isBlank()) {
            throw new IllegalArgumentException("missing '" + field + "'");
        }
        return v.asText();
    }

    private static double requireNumber(JsonNode data, String field) {
        JsonNode v = data.path(field);
        if (!v.isNumber()) {
            throw new IllegalArgumentException("missing numeric '" + field + "'");
        }
        return v.asDouble();
    }

    // ---------- outbound ----------

    public byte[] encodeReply(double now, List<Decision> decisions) {
        List<WireEvent> events = new ArrayList<>(decisions.size());
        for (Decision d : decisions) {
            events.add(new WireEvent(now, d.type().name(), encodeData(d)));
        }
        try {
            return MAPPER.writeValueAsBytes(new WireMessage(now, events));
        } catch (JsonProcessingException e) {
            throw new ProtocolException("cannot encode reply at " + now, e);
        }
    }

    private Map<String, Object> encodeData(Decision d) {
        Map<String, Object> data = new LinkedHashMap<>();
        if (d instanceof ExecuteJob execute) {
            data.put("job_id", execute.jobId());
            data.put("alloc", IntervalSet.format(execute.hostIds()));
        } else if (d instanceof RejectJob reject) {
            data.put("job_id", reject.jobId());
        } else if (d instanceof SetResourceState set) {
            data.put("resources", IntervalSet.format(set.hostIds()));
            data.put("state", encodeState(set.target()));
        } else if (d instanceof CallMeLater call) {
            data.put("timestamp", call.at());
        } else if (d instanceof Decision.QueryConsumedEnergy) {
            data.put("requests", Map.of("consumed_energy", Map.of()));
        } else {
            throw new ProtocolException("cannot encode decision " + d);
        }
        return data;
    }

    /**
     * Outbound envelope.
     */
    public record WireMessage(
            @JsonProperty("now") double now,
            @JsonProperty("events") List<WireEvent> events) {
    }

    /**
     * A single outbound event.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record WireEvent(
            @JsonProperty("timestamp") double timestamp,
            @JsonProperty("type") String type,
            @JsonProperty("data") Map<String, Object> data) {
    }
}
