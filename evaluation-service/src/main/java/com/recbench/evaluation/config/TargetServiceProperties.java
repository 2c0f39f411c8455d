package com.recbench.evaluation.config;

import com.recbench.evaluation.adapter.ServiceShape;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@ConfigurationProperties(prefix = "evaluation")
public class TargetServiceProperties {

    private List<Target> targets = new ArrayList<>();

    public List<Target> getTargets() {
        return targets;
    }

    public void setTargets(List<Target> targets) {
        this.targets = targets == null ? new ArrayList<>() : targets;
    }

    public Optional<Target> find(String serviceId) {
        if (serviceId == null) {
            return Optional.empty();
        }
        return targets.stream().filter(t -> serviceId.equals(t.getId())).findFirst();
    }

    public List<String> ids() {
        List<String> ids = new ArrayList<>();
        for (Target target : targets) {
            ids.add(target.getId());
        }
        return ids;
    }

    public static class Target {
        private String id;
        private ServiceShape shape;
        private String baseUrl;
        private String path;
        private Integer maxTopScenarios;

        public Target() {
        }

        public Target(String id, ServiceShape shape, String baseUrl, String path, Integer maxTopScenarios) {
            this.id = id;
            this.shape = shape;
            this.baseUrl = baseUrl;
            this.path = path;
            this.maxTopScenarios = maxTopScenarios;
        }

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public ServiceShape getShape() {
            return shape;
        }

        public void setShape(ServiceShape shape) {
            this.shape = shape;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public Integer getMaxTopScenarios() {
            return maxTopScenarios;
        }

        public void setMaxTopScenarios(Integer maxTopScenarios) {
            this.maxTopScenarios = maxTopScenarios;
        }
    }
}
