package in.mockbroker.infrastructure.sink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.mockbroker.domain.order.ExecReport;

import java.math.BigDecimal;

public final class ExecReportJsonMapper {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ExecReportJsonMapper() {}

    public static String toJson(ExecReport r) {
        ObjectNode o = MAPPER.createObjectNode();

        o.put("clientOrderId", r.clientOrderId());
        if (r.symbol() != null) o.put("symbol", r.symbol());
        o.put("status", r.status().name());

        putDecimal(o, "filledQty", r.filledQty());
        putDecimal(o, "avgPx", r.avgPx());

        if (r.timestamp() != null) {
            o.put("timestamp", r.timestamp().toString());
            o.put("timestampMs", r.timestamp().toEpochMilli());
        }

        try {
            return MAPPER.writeValueAsString(o);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render report " + r.clientOrderId(), e);
        }
    }

    private static void putDecimal(ObjectNode o, String key, BigDecimal v) {
        if (v == null) return;
        o.put(key, v.toPlainString());
    }
}
