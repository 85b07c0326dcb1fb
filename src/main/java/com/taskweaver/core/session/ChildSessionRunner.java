package com.taskweaver.core.session;

import com.taskweaver.core.concurrent.CancellationToken;
import com.taskweaver.core.error.ConfigurationException;
import com.taskweaver.core.host.Host;
import com.taskweaver.core.host.SessionHandle;
import com.taskweaver.core.logging.MdcContext;
import com.taskweaver.core.model.ChildResult;
import com.taskweaver.core.model.DelegationConfig;
import com.taskweaver.core.model.WorkItem;
import com.taskweaver.core.template.PromptBindings;
import com.taskweaver.core.template.TemplateEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Starts one child session for a delegation, renders its messages and hands it to
 * the {@link ChildSessionCoordinator}.
 */
@Component
public class ChildSessionRunner {

    private static final Logger log = LoggerFactory.getLogger(ChildSessionRunner.class);

    private final Host host;
    private final TemplateEngine templateEngine;
    private final ChildSessionCoordinator coordinator;

    public ChildSessionRunner(Host host, TemplateEngine templateEngine, ChildSessionCoordinator coordinator) {
        this.host = host;
        this.templateEngine = templateEngine;
        this.coordinator = coordinator;
    }

    /**
     * Runs one child session to completion.
     *
     * @param parent        the session that delegated the work
     * @param assistantName assistant driving the child
     * @param requestArgs   arguments of the delegate call
     * @param config        delegation configuration
     * @param item          work item of a parallel run, or null on the single path
     * @param token         cancellation for this child
     */
    public ChildResult run(SessionHandle parent, String assistantName, Map<String, Object> requestArgs,
                           DelegationConfig config, WorkItem item, CancellationToken token) {
        if (config.urgingMessage() == null || config.urgingMessage().isBlank()) {
            throw new ConfigurationException("Urging message must not be empty");
        }
        token.throwIfCancelled();

        Map<String, Object> bindings = PromptBindings.build(requestArgs, config, item);
        String prompt = templateEngine.render(config.promptMessage(), bindings);
        String urging = templateEngine.render(config.urgingMessage(), bindings);

        SessionHandle child = host.createChildSession(parent, assistantName);
        MdcContext.setChildSession(child.id());
        log.info("Started child session {} with assistant '{}'{}", child.id(), assistantName,
                item != null ? " for " + item.label() : "");
        return coordinator.await(child, config, prompt, urging, token);
    }
}
