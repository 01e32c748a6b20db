package com.forgeloop.core.agent;

import com.forgeloop.core.config.ForgeloopProperties;
import com.forgeloop.core.model.AgentRole;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PathRoleClassifierTest {

    private final PathRoleClassifier classifier = new PathRoleClassifier(new ForgeloopProperties());

    @ParameterizedTest
    @ValueSource(strings = {"src/components/Button.tsx", "src/index.css", "tailwind.config.js"})
    @DisplayName("presentation files go to the frontend expert")
    void frontend(String path) {
        assertEquals(AgentRole.FRONTEND_EXPERT, classifier.coderFor(path));
    }

    @ParameterizedTest
    @ValueSource(strings = {"server/index.js", "package.json", "src/App.tsx", "db/schema.sql"})
    @DisplayName("everything else goes to the backend expert")
    void backend(String path) {
        assertEquals(AgentRole.BACKEND_EXPERT, classifier.coderFor(path));
    }

    @Test
    @DisplayName("custom rules replace the defaults")
    void customRules() {
        var custom = new PathRoleClassifier(List.of("web/"), List.of(".vue"));
        assertEquals(AgentRole.FRONTEND_EXPERT, custom.coderFor("web/main.ts"));
        assertEquals(AgentRole.FRONTEND_EXPERT, custom.coderFor("App.vue"));
        assertEquals(AgentRole.BACKEND_EXPERT, custom.coderFor("src/components/Button.tsx"));
    }
}
