package com.counter.api;

import com.counter.cluster.StorageNode;
import com.counter.metric.MetricsRegistry;
import com.counter.service.CountResult;
import com.counter.service.CounterMetrics;
import com.counter.service.CounterService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Ziyaret sayacının HTTP yüzeyi. İş mantığı {@link CounterService} içindedir; bu
 * katman yalnızca istekleri servise iletir ve yanıtları JSON'a çevirir.
 */
@Path("/api/v1")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class CounterResource {

    static final String SERVICE_NAME = "visit_counter";

    private final CounterService counterService;
    private final MetricsRegistry metrics;

    @Inject
    public CounterResource(CounterService counterService, MetricsRegistry metrics) {
        this.counterService = counterService;
        this.metrics = metrics;
    }

    @POST
    @Path("counter/visit/{key}")
    public VisitResponse recordVisit(@PathParam("key") String key) {
        counterService.recordVisit(key);
        return new VisitResponse("success", "Visit recorded for page " + key, key);
    }

    @GET
    @Path("counter/visits/{key}")
    public VisitCount getVisits(@PathParam("key") String key) {
        CountResult result = counterService.getCount(key);
        String servedVia = result.fromCache() ? "in_memory" : "redis_" + result.nodeId();
        return new VisitCount(result.value(), servedVia, result.source().name().toLowerCase(Locale.ROOT), result.nodeId());
    }

    @DELETE
    @Path("counter/visits/{key}")
    public ResetResponse reset(@PathParam("key") String key) {
        counterService.resetCount(key);
        return new ResetResponse("success", "Counter reset for page " + key);
    }

    @GET
    @Path("counter/status")
    public CounterMetrics status() {
        return counterService.metrics();
    }

    @GET
    @Path("health")
    public HealthResponse health() {
        return new HealthResponse("healthy", SERVICE_NAME);
    }

    @GET
    @Path("metrics")
    public MetricsResponse metrics() {
        List<String> shards = counterService.registry().nodes().stream()
                .map(StorageNode::address)
                .toList();
        return new MetricsResponse("available", shards, counterService.registry().distribution(),
                metrics.counterValues());
    }

    public record VisitResponse(String status, String message, String key) {}

    public record VisitCount(long visits, String servedVia, String source, String node) {}

    public record ResetResponse(String status, String message) {}

    public record HealthResponse(String status, String service) {}

    public record MetricsResponse(String status, List<String> shards, Map<String, Integer> virtualNodes,
                                  Map<String, Long> counters) {}

    public record ErrorResponse(String status, String detail) {}
}
