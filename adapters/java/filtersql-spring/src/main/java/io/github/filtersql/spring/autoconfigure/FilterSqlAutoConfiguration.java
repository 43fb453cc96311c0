package io.github.filtersql.spring.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.filtersql.core.FilterConditionCompiler;
import io.github.filtersql.core.aggregation.AggregationCategorizer;
import io.github.filtersql.core.handler.FilterHandler;
import io.github.filtersql.core.handler.FilterHandlerRegistry;
import io.github.filtersql.core.handler.custom.ArrayOperatorHandler;
import io.github.filtersql.core.parsing.FilterPropertiesParser;
import io.github.filtersql.core.widget.WidgetQueryAssembler;
import io.github.filtersql.spring.support.FilterCompilerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;

import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.stream.Collectors;

/**
 * Registers the filter compiler infrastructure.
 * <p>
 * Every {@link FilterHandler} bean of the application is collected once, in {@link Order} order,
 * into the {@link FilterHandlerRegistry}; handlers cannot be added afterwards. Compilers are then
 * obtained from the {@link FilterCompilerFactory}, which gives each of them its own reference
 * instant taken from the {@link Clock} bean.
 * </p>
 */
@AutoConfiguration
@ConditionalOnClass(FilterConditionCompiler.class)
@EnableConfigurationProperties(FilterSqlProperties.class)
public class FilterSqlAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock filterSqlClock() {
        return Clock.systemUTC();
    }

    @Bean
    @Order(Ordered.LOWEST_PRECEDENCE)
    @ConditionalOnMissingBean(ArrayOperatorHandler.class)
    @ConditionalOnProperty(prefix = "filtersql", name = "array-operators", havingValue = "true", matchIfMissing = true)
    public ArrayOperatorHandler arrayOperatorHandler() {
        return new ArrayOperatorHandler();
    }

    @Bean
    @ConditionalOnMissingBean
    public FilterHandlerRegistry filterHandlerRegistry(ObjectProvider<FilterHandler> handlers) {
        FilterHandlerRegistry.Builder builder = FilterHandlerRegistry.builder();
        handlers.orderedStream().forEach(builder::register);
        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    public AggregationCategorizer aggregationCategorizer(FilterSqlProperties properties) {
        return new AggregationCategorizer(properties.getAggregationAliases().stream()
                .collect(Collectors.toCollection(LinkedHashSet::new)));
    }

    @Bean
    @ConditionalOnMissingBean
    public FilterCompilerFactory filterCompilerFactory(FilterHandlerRegistry registry,
                                                       FilterSqlProperties properties,
                                                       Clock clock) {
        return new FilterCompilerFactory(registry, properties, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public FilterPropertiesParser filterPropertiesParser(ObjectProvider<ObjectMapper> objectMapper) {
        return new FilterPropertiesParser(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public WidgetQueryAssembler widgetQueryAssembler(AggregationCategorizer categorizer,
                                                     ObjectProvider<ObjectMapper> objectMapper) {
        return new WidgetQueryAssembler(categorizer, objectMapper.getIfAvailable(ObjectMapper::new));
    }
}
