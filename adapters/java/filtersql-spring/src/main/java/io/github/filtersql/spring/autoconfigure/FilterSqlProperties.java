package io.github.filtersql.spring.autoconfigure;

import io.github.filtersql.core.config.EscapeStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings of the filter compiler, bound from {@code filtersql.*}.
 *
 * <pre>
 * filtersql:
 *   time-zone: Europe/Paris
 *   escape-strategy: parameterized
 *   service-type: data-explorer
 *   aggregation-aliases: [value, total]
 *   array-operators: true
 * </pre>
 */
@ConfigurationProperties(prefix = "filtersql")
public class FilterSqlProperties {

    /** Zone whose calendar defines day boundaries of relative dates. */
    private String timeZone = "UTC";

    /** How values are rendered in compiled SQL. */
    private EscapeStrategy escapeStrategy = EscapeStrategy.PARAMETERIZED;

    /** Service type reported by the filter contexts created by the factory. */
    private String serviceType = "data-explorer";

    /** Metric aliases routed to HAVING in aggregated queries. */
    private List<String> aggregationAliases = new ArrayList<>(List.of("value"));

    /** Registers the PostgreSQL array operator handler. */
    private boolean arrayOperators = true;

    public String getTimeZone() {
        return timeZone;
    }

    public void setTimeZone(String timeZone) {
        this.timeZone = timeZone;
    }

    /**
     * @return the parsed {@link #getTimeZone() time zone}
     * @throws java.time.DateTimeException if the configured zone id is invalid
     */
    public ZoneId getZoneId() {
        return ZoneId.of(timeZone);
    }

    public EscapeStrategy getEscapeStrategy() {
        return escapeStrategy;
    }

    public void setEscapeStrategy(EscapeStrategy escapeStrategy) {
        this.escapeStrategy = escapeStrategy;
    }

    public String getServiceType() {
        return serviceType;
    }

    public void setServiceType(String serviceType) {
        this.serviceType = serviceType;
    }

    public List<String> getAggregationAliases() {
        return aggregationAliases;
    }

    public void setAggregationAliases(List<String> aggregationAliases) {
        this.aggregationAliases = aggregationAliases;
    }

    public boolean isArrayOperators() {
        return arrayOperators;
    }

    public void setArrayOperators(boolean arrayOperators) {
        this.arrayOperators = arrayOperators;
    }
}
