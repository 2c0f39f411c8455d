package com.recbench.evaluation.adapter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.recbench.evaluation.config.TargetServiceProperties;
import com.recbench.evaluation.exception.ServiceUnavailableException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServiceAdapterFactoryTest {

    private static ServiceAdapterFactory factory() {
        TargetServiceProperties properties = new TargetServiceProperties();
        properties.setTargets(List.of(
                new TargetServiceProperties.Target("recommend", ServiceShape.STRUCTURED, "http://localhost:8000", null, null),
                new TargetServiceProperties.Target("recommend-simple", ServiceShape.SIMPLIFIED_STRUCTURED, "http://localhost:8000", "/recommend_simple_final_choices", 4),
                new TargetServiceProperties.Target("intelligent-recommendation", ServiceShape.FLAT_LIST, "http://localhost:5189", null, null),
                new TargetServiceProperties.Target("recommend_item_with_reason", ServiceShape.STREAMING, "http://localhost:5187", null, null),
                new TargetServiceProperties.Target("no-shape", null, "http://localhost:9000", null, null),
                new TargetServiceProperties.Target("no-url", ServiceShape.FLAT_LIST, " ", null, null)
        ));
        return new ServiceAdapterFactory(properties, new ObjectMapper());
    }

    @Test
    void buildsOneAdapterPerShape() {
        ServiceAdapterFactory factory = factory();

        assertThat(factory.create("recommend")).isInstanceOf(StructuredRecommendationAdapter.class);
        assertThat(factory.create("recommend-simple")).isInstanceOf(SimplifiedStructuredAdapter.class);
        assertThat(factory.create("intelligent-recommendation")).isInstanceOf(FlatListAdapter.class);
        assertThat(factory.create("recommend_item_with_reason")).isInstanceOf(StreamingItemAdapter.class);
        assertThat(factory.create("recommend")).isSameAs(factory.create("recommend"));
    }

    @Test
    void rejectsUnknownOrIncompleteTargets() {
        ServiceAdapterFactory factory = factory();

        assertThatThrownBy(() -> factory.create("missing"))
                .isInstanceOf(ServiceUnavailableException.class)
                .hasMessageContaining("unknown target service");
        assertThatThrownBy(() -> factory.create("no-shape")).isInstanceOf(ServiceUnavailableException.class);
        assertThatThrownBy(() -> factory.create("no-url"))
                .isInstanceOfSatisfying(ServiceUnavailableException.class,
                        ex -> assertThat(ex.getServiceId()).isEqualTo("no-url"));
    }
}
