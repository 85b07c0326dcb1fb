package com.taskweaver.core.parallel;

import com.taskweaver.core.concurrent.CancellationToken;
import com.taskweaver.core.model.ChildResult;
import com.taskweaver.core.model.WorkItem;

/**
 * Runs the child session for one work item and blocks until it settles.
 */
@FunctionalInterface
public interface ChildRunner {

    ChildResult run(WorkItem item, CancellationToken token);
}
