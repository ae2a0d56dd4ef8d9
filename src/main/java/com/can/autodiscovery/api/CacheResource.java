package com.can.autodiscovery.api;

import com.can.autodiscovery.core.CacheBackend;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Keşfedilen memcached kümesini HTTP üzerinden okumak ve güncellemek için
 * sağlanan REST kaynağı. İstekler kendini onaran {@link CacheBackend}
 * bean'ine yönlendirilir; arka uç hataları bu paketteki
 * {@code ExceptionMapper}'lar tarafından HTTP durum kodlarına çevrilir.
 */
@Path("/cache")
@ApplicationScoped
@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
public class CacheResource {

    private final CacheBackend cache;

    @Inject
    public CacheResource(CacheBackend cache) {
        this.cache = cache;
    }

    @GET
    @Path("{key}")
    public Response get(@PathParam("key") String key) {
        return cache.get(key)
                .map(value -> Response.ok(new CacheEntry(key, value)).build())
                .orElseGet(() -> Response.status(Response.Status.NOT_FOUND)
                        .entity(new ErrorResponse("Key not found"))
                        .build());
    }

    @PUT
    @Path("{key}")
    public Response put(@PathParam("key") String key, CacheWriteRequest request) {
        if (request == null || request.value() == null) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(new ErrorResponse("value must be provided"))
                    .build();
        }
        if (!cache.set(key, request.value(), ttlDuration(request.ttlSeconds()))) {
            return Response.status(Response.Status.BAD_GATEWAY)
                    .entity(new ErrorResponse("Value was not stored"))
                    .build();
        }
        return Response.noContent().build();
    }

    @DELETE
    @Path("{key}")
    public Response delete(@PathParam("key") String key) {
        if (!cache.delete(key)) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(new ErrorResponse("Key not found"))
                    .build();
        }
        return Response.noContent().build();
    }

    @POST
    @Path("_bulk/get")
    public Response getMany(BulkGetRequest request) {
        if (request == null || request.keys() == null) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(new ErrorResponse("keys must be provided"))
                    .build();
        }
        return Response.ok(cache.getMany(request.keys())).build();
    }

    @PUT
    @Path("_bulk")
    public Response setMany(BulkWriteRequest request) {
        if (request == null || request.entries() == null) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(new ErrorResponse("entries must be provided"))
                    .build();
        }
        if (!cache.setMany(request.entries(), ttlDuration(request.ttlSeconds()))) {
            return Response.status(Response.Status.BAD_GATEWAY)
                    .entity(new ErrorResponse("Not all entries were stored"))
                    .build();
        }
        return Response.noContent().build();
    }

    static Duration ttlDuration(Long ttlSeconds) {
        if (ttlSeconds == null || ttlSeconds <= 0) {
            return null;
        }
        return Duration.ofSeconds(ttlSeconds);
    }

    public record CacheEntry(String key, String value) {}

    public record ErrorResponse(String message) {}

    public record BulkGetRequest(List<String> keys) {}

    public record BulkWriteRequest(Map<String, String> entries, Long ttlSeconds) {}

    public static final class CacheWriteRequest {
        private String value;
        private Long ttlSeconds;

        public CacheWriteRequest() {
        }

        public CacheWriteRequest(String value, Long ttlSeconds) {
            this.value = value;
            this.ttlSeconds = ttlSeconds;
        }

        public String value() {
            return value;
        }

        public Long ttlSeconds() {
            return ttlSeconds;
        }

        public void setValue(String value) {
            this.value = value;
        }

        public void setTtlSeconds(Long ttlSeconds) {
            this.ttlSeconds = ttlSeconds;
        }

        @Override
        public int hashCode() {
            return Objects.hash(value, ttlSeconds);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            CacheWriteRequest that = (CacheWriteRequest) o;
            return Objects.equals(value, that.value) && Objects.equals(ttlSeconds, that.ttlSeconds);
        }
    }
}
