package io.meshgraph.export;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.meshgraph.model.EntityKind;
import io.meshgraph.model.MeshMessage;
import io.meshgraph.storage.MeshStore;
import io.meshgraph.util.Jsons;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Hourly message statistics over a horizon of whole days.
 *
 * <p>The horizon is cut into {@code 24 * days} consecutive one-hour buckets ending with
 * the hour that contains "now" in the configured zone. Every bucket is present in the
 * output, zero-filled when empty.
 */
public final class SeriesExporter {
    private static final long HOUR_MS = 3_600_000L;
    private static final DateTimeFormatter BUCKET_LABEL = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:00");

    private final MeshStore store;
    private final Clock clock;
    private final ZoneId zone;

    public SeriesExporter(MeshStore store, Clock clock, ZoneId zone) {
        this.store = store;
        this.clock = clock;
        this.zone = zone;
    }

    public HourlySeries hourly(int days) {
        if (days < 1) {
            throw new IllegalArgumentException("days must be >= 1, got " + days);
        }
        Instant now = clock.instant();
        int buckets = 24 * days;
        ZonedDateTime currentHour = now.atZone(zone).truncatedTo(ChronoUnit.HOURS);
        ZonedDateTime first = currentHour.minusHours(buckets - 1L);
        long firstMs = first.toInstant().toEpochMilli();
        long endMs = firstMs + buckets * HOUR_MS - 1L;

        List<String> labels = new ArrayList<>(buckets);
        for (int i = 0; i < buckets; i++) {
            labels.add(BUCKET_LABEL.format(Instant.ofEpochMilli(firstMs + i * HOUR_MS).atZone(zone)));
        }

        Map<String, long[]> countsByType = new TreeMap<>();
        List<Set<Long>> senders = newBucketSets(buckets);
        List<Set<Long>> physical = newBucketSets(buckets);
        Set<Long> allSenders = new HashSet<>();
        Set<Long> allPhysical = new HashSet<>();
        long total = 0L;

        for (MeshMessage m : store.queryRange(EntityKind.MESSAGES, firstMs, endMs)) {
            int bucket = (int) ((m.timestampMs() - firstMs) / HOUR_MS);
            senders.get(bucket).add(m.fromId());
            physical.get(bucket).add(m.physicalSenderId());
            allSenders.add(m.fromId());
            allPhysical.add(m.physicalSenderId());
            if (m.type() == null || m.type().isBlank()) {
                continue;
            }
            countsByType.computeIfAbsent(m.type(), k -> new long[buckets])[bucket]++;
            total++;
        }

        long[] uniqueSenders = new long[buckets];
        long[] uniquePhysical = new long[buckets];
        for (int i = 0; i < buckets; i++) {
            uniqueSenders[i] = senders.get(i).size();
            uniquePhysical[i] = physical.get(i).size();
        }
        return new HourlySeries(
                labels,
                countsByType,
                uniqueSenders,
                uniquePhysical,
                allSenders.size(),
                allPhysical.size(),
                total,
                now
        );
    }

    private static List<Set<Long>> newBucketSets(int buckets) {
        List<Set<Long>> out = new ArrayList<>(buckets);
        for (int i = 0; i < buckets; i++) {
            out.add(new HashSet<>());
        }
        return out;
    }

    static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    public record HourlySeries(
            List<String> labels,
            Map<String, long[]> countsByType,
            long[] uniqueSenders,
            long[] uniquePhysicalSenders,
            long totalUniqueSenders,
            long totalUniquePhysicalSenders,
            long totalMessages,
            Instant generatedAt
    ) {

        public List<String> types() {
            return new ArrayList<>(countsByType.keySet());
        }

        public long typeTotal(String type) {
            long[] counts = countsByType.get(type);
            long sum = 0L;
            if (counts != null) {
                for (long c : counts) {
                    sum += c;
                }
            }
            return sum;
        }

        public ObjectNode messagesJson() {
            ObjectNode root = Jsons.mapper().createObjectNode();
            ArrayNode x = root.putArray("x");
            labels.forEach(x::add);
            ArrayNode types = root.putArray("types");
            countsByType.keySet().forEach(types::add);
            ObjectNode data = root.putObject("data");
            for (Map.Entry<String, long[]> e : countsByType.entrySet()) {
                ArrayNode series = data.putArray(e.getKey());
                for (long c : e.getValue()) {
                    series.add(c);
                }
            }
            ObjectNode metadata = root.putObject("metadata");
            metadata.put("total_messages", totalMessages);
            ObjectNode byType = metadata.putObject("messages_by_type");
            Map<String, Long> totals = new LinkedHashMap<>();
            for (String type : countsByType.keySet()) {
                totals.put(type, typeTotal(type));
            }
            for (Map.Entry<String, Long> e : totals.entrySet()) {
                byType.put(e.getKey(), e.getValue());
                double pct = totalMessages == 0L ? 0.0 : e.getValue() * 100.0 / totalMessages;
                byType.put(e.getKey() + "_percentage", round2(pct));
            }
            metadata.put("generated_at", generatedAt.toString());
            return root;
        }

        public ObjectNode uniqueSendersJson() {
            ObjectNode root = Jsons.mapper().createObjectNode();
            ArrayNode x = root.putArray("x");
            labels.forEach(x::add);
            ArrayNode senders = root.putArray("unique_senders");
            ArrayNode physical = root.putArray("unique_physical_senders");
            long senderSum = 0L;
            long physicalSum = 0L;
            for (int i = 0; i < labels.size(); i++) {
                senders.add(uniqueSenders[i]);
                physical.add(uniquePhysicalSenders[i]);
                senderSum += uniqueSenders[i];
                physicalSum += uniquePhysicalSenders[i];
            }
            int hours = Math.max(1, labels.size());
            ObjectNode metadata = root.putObject("metadata");
            metadata.put("total_unique_senders", totalUniqueSenders);
            metadata.put("total_unique_physical_senders", totalUniquePhysicalSenders);
            metadata.put("average_unique_senders_per_hour", round2((double) senderSum / hours));
            metadata.put("average_unique_physical_senders_per_hour", round2((double) physicalSum / hours));
            metadata.put("generated_at", generatedAt.toString());
            return root;
        }
    }
}
