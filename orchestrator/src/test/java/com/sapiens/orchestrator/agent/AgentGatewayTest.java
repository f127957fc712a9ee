package com.sapiens.orchestrator.agent;

import com.sapiens.orchestrator.agent.contract.*;
import com.sapiens.orchestrator.artifact.Evaluation;
import com.sapiens.orchestrator.model.AgentCapability;
import com.sapiens.orchestrator.model.Phase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AgentGatewayTest {

    @Mock Agent<GeneratorInput, GeneratorOutput>  generator;
    @Mock Agent<EvaluationInput, Evaluation>      evaluator;
    @Mock Agent<ProgressInput, ProgressOutput>    progressTracker;
    @Mock Agent<ReviewInput, ReviewOutput>        reviewer;
    @Mock AgentInvoker invoker;

    AgentGatewayFactory factory;

    static final GeneratorInput INPUT = new GeneratorInput("PM", "Fintech", null, null, List.of());

    @BeforeEach
    void setUp() {
        factory = new AgentGatewayFactory(
                new AgentGatewayFactory.Agents(generator, evaluator, progressTracker, reviewer), invoker);
    }

    @Test
    void capabilityFor_phaseTable() {
        assertThat(AgentGatewayFactory.capabilityFor(Phase.ONBOARDING)).isEqualTo(AgentCapability.GENERATOR);
        assertThat(AgentGatewayFactory.capabilityFor(Phase.SOLUTION_DESIGN)).isEqualTo(AgentCapability.EVALUATOR);
        assertThat(AgentGatewayFactory.capabilityFor(Phase.EXECUTION)).isEqualTo(AgentCapability.PROGRESS_TRACKER);
        assertThat(AgentGatewayFactory.capabilityFor(Phase.REVIEW)).isEqualTo(AgentCapability.REVIEWER);
        assertThat(AgentGatewayFactory.capabilityFor(Phase.COMPLETED)).isNull();
    }

    @Test
    void generateProject_allowedCapability_delegatesToInvoker() {
        AgentGateway gateway = factory.open(new AgentContext("r1", "u1", Phase.ONBOARDING));
        when(invoker.invoke(eq(AgentCapability.GENERATOR), eq(generator), eq(INPUT), any()))
                .thenReturn(new AgentResult.Malformed<>("x"));

        gateway.generateProject(INPUT);

        assertThat(gateway.wasUsed()).isTrue();
        assertThat(gateway.usedCapability()).isEqualTo(AgentCapability.GENERATOR);
    }

    @Test
    void secondInvocation_inSameRequest_isRefused() {
        AgentGateway gateway = factory.open(new AgentContext("r1", "u1", Phase.PROJECT_GENERATION));
        when(invoker.invoke(any(), any(), any(), any())).thenReturn(new AgentResult.Malformed<>("x"));

        gateway.generateProject(INPUT);

        assertThatThrownBy(() -> gateway.generateProject(INPUT))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already invoked");
        verify(invoker, times(1)).invoke(any(), any(), any(), any());
    }

    @Test
    void wrongCapability_forPhase_isRefused() {
        AgentGateway gateway = factory.open(new AgentContext("r1", "u1", Phase.EXECUTION));

        assertThatThrownBy(() -> gateway.generateProject(INPUT))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("not allowed");
        verifyNoInteractions(invoker);
        assertThat(gateway.wasUsed()).isFalse();
    }

    @Test
    void completedPhase_allowsNoAgent() {
        AgentGateway gateway = factory.open(new AgentContext("r1", "u1", Phase.COMPLETED));

        assertThat(gateway.allowedCapability()).isNull();
        assertThatThrownBy(() -> gateway.generateProject(INPUT)).isInstanceOf(IllegalStateException.class);
    }
}
