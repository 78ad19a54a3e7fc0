package com.chimera.core.dispatch;

import com.chimera.core.agent.AgentRegistry;
import com.chimera.core.agent.Registration;
import com.chimera.core.catalog.AbilityCatalog;
import com.chimera.core.config.ChimeraProperties;
import com.chimera.core.engine.OperationController;
import com.chimera.core.engine.OperationService;
import com.chimera.core.link.ReportOutcome;
import com.chimera.core.logging.MdcContext;
import com.chimera.core.metrics.ChimeraMetrics;
import com.chimera.core.model.Agent;
import com.chimera.core.model.Link;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

/**
 * Server side of the pull protocol. Agents beacon to collect work and post
 * results back; per-link and per-agent problems never surface as exceptions here.
 */
@Service
public class BeaconHandler {

    private static final Logger log = LoggerFactory.getLogger(BeaconHandler.class);

    private final AgentRegistry agents;
    private final OperationService operations;
    private final AbilityCatalog catalog;
    private final ChimeraMetrics metrics;
    private final Duration defaultTimeout;

    public BeaconHandler(AgentRegistry agents, OperationService operations, AbilityCatalog catalog,
                         ChimeraMetrics metrics, ChimeraProperties properties) {
        this.agents = agents;
        this.operations = operations;
        this.catalog = catalog;
        this.metrics = metrics;
        this.defaultTimeout = properties.getLinkTimeout();
    }

    /**
     * Registers or refreshes the agent, joins it to every matching operation
     * and hands over its QUEUED links.
     */
    public BeaconResponse beacon(BeaconRequest request) {
        Registration registration = agents.register(request.paw(), request.platform(), request.hostname(),
                request.group(), request.executors(), request.sleepSeconds(), request.jitterSeconds());
        Agent agent = registration.agent();
        MdcContext.setAgent(agent.paw());
        try {
            var instructions = new ArrayList<Instruction>();
            for (OperationController controller : operations.recruiting(agent)) {
                for (Link link : controller.beacon(agent)) {
                    instructions.add(new Instruction(link.id(), link.operationId(), link.command(),
                            link.executor(), timeoutFor(link).toSeconds()));
                }
            }
            if (instructions.isEmpty()) {
                log.debug("Beacon from {}: no work", agent.paw());
            } else {
                log.info("Beacon from {}: {} instruction(s)", agent.paw(), instructions.size());
            }
            return new BeaconResponse(agent.paw(), agent.sleepSeconds(), List.copyOf(instructions));
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Routes a result to the operation owning the link.
     *
     * @throws IllegalArgumentException when {@code encoded} is set and the output is not valid base64
     */
    public ReportOutcome report(ResultReport report) {
        String output = decode(report);
        Optional<OperationController> owner = report.linkId() == null
                ? Optional.empty() : operations.findByLink(report.linkId());
        if (owner.isEmpty()) {
            log.warn("Rejected report for unknown link {} from agent {}", report.linkId(), report.paw());
            metrics.recordRejectedReport(ReportOutcome.RejectReason.UNKNOWN_LINK.name());
            return ReportOutcome.rejected(ReportOutcome.RejectReason.UNKNOWN_LINK);
        }
        return owner.get().report(report.paw(), report.linkId(), output, report.exitCode(), report.succeeded());
    }

    private Duration timeoutFor(Link link) {
        if (catalog.contains(link.abilityId()) && catalog.ability(link.abilityId()).timeout() != null) {
            return catalog.ability(link.abilityId()).timeout();
        }
        return defaultTimeout;
    }

    private static String decode(ResultReport report) {
        if (!report.encoded() || report.output() == null) {
            return report.output();
        }
        try {
            return new String(Base64.getDecoder().decode(report.output().trim()), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Output of link " + report.linkId() + " is not valid base64", e);
        }
    }
}
