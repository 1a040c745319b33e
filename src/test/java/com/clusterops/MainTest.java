package com.clusterops;

import com.clusterops.atlas.AtlasAuditingFeature;
import com.clusterops.atlas.AtlasClusterProvider;
import com.clusterops.orchestrator.OrchestratorConfig;
import com.clusterops.provider.DisabledFeature;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MainTest {
    private static OrchestratorConfig config(String provider, String feature) {
        Properties p = new Properties();
        p.setProperty("provider.type", provider);
        p.setProperty("feature.type", feature);
        p.setProperty("atlas.groupId", "grp1");
        p.setProperty("atlas.accessToken", "token");
        return new OrchestratorConfig(p);
    }

    @Test
    void atlasWithAuditing() {
        OrchestratorConfig config = config("atlas", "auditing");

        assertThat(Main.providerFor(config)).isInstanceOf(AtlasClusterProvider.class);
        assertThat(Main.featureFor(config)).isInstanceOf(AtlasAuditingFeature.class);
    }

    @Test
    void auditingIsDisabledOutsideAtlas() {
        assertThat(Main.featureFor(config("rds", "auditing"))).isInstanceOf(DisabledFeature.class);
        assertThat(Main.featureFor(config("atlas", "none"))).isInstanceOf(DisabledFeature.class);
    }

    @Test
    void unknownTypesAreRejected() {
        assertThatThrownBy(() -> Main.providerFor(config("gcp", "none")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("gcp");
        assertThatThrownBy(() -> Main.featureFor(config("atlas", "backup")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
