package org.kingstonaccess.service.config;

import lombok.Data;
import org.kingstonaccess.service.model.BoundingBox;
import org.kingstonaccess.service.model.GeoPoint;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;

/**
 * The fixed region the service answers for.
 */
@Data
@ConfigurationProperties(prefix = "app.region")
public class RegionProperties {

    /** Display name, also the last-resort subtitle for geocoding hits. */
    private String name = "Kingston";

    /** Zone used for "local hour" in availability predictions. */
    private String zoneId = "America/Toronto";

    private Bounds bounds = new Bounds();

    private Anchor downtown = new Anchor();

    public ZoneId zone() {
        return ZoneId.of(zoneId);
    }

    public BoundingBox defaultBounds() {
        return new BoundingBox(bounds.getMinLat(), bounds.getMaxLat(), bounds.getMinLng(), bounds.getMaxLng());
    }

    public GeoPoint downtownCenter() {
        return new GeoPoint(downtown.getLat(), downtown.getLon());
    }

    @Data
    public static class Bounds {
        private double minLat = 44.10;
        private double maxLat = 44.40;
        private double minLng = -76.70;
        private double maxLng = -76.20;
    }

    @Data
    public static class Anchor {
        private double lat = 44.2312;
        private double lon = -76.4860;
    }
}
