package io.queueflow.spring.boot;

import io.queueflow.QueueFlow;

import org.springframework.beans.factory.SmartInitializingSingleton;

import java.util.logging.Logger;

/**
 * Starts the worker once every singleton has been created, so tasks declared by
 * application beans are registered before the first claim.
 */
public class QueueFlowWorkerStarter implements SmartInitializingSingleton {
    private static final Logger logger = Logger.getLogger(QueueFlowWorkerStarter.class.getName());

    private final QueueFlow queueFlow;

    public QueueFlowWorkerStarter(QueueFlow queueFlow) {
        this.queueFlow = queueFlow;
    }

    @Override
    public void afterSingletonsInstantiated() {
        logger.fine("Starting QueueFlow worker after context initialization");
        queueFlow.startWorker();
    }
}
