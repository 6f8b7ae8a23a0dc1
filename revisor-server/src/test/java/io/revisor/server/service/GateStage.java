package io.revisor.server.service;

import io.revisor.core.stage.Stage;
import io.revisor.core.stage.StageContext;
import io.revisor.core.stage.StageFailure;
import io.revisor.core.stage.StageOutcome;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/// Test stage that holds every attempt until released, keeping its task `RUNNING`.
public class GateStage implements Stage {

    private final CountDownLatch entered = new CountDownLatch(1);
    private final CountDownLatch release = new CountDownLatch(1);

    @Override
    public String name() {
        return "gate";
    }

    @Override
    public StageOutcome execute(StageContext context) throws StageFailure {
        entered.countDown();
        try {
            release.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw StageFailure.permanentFailure("interrupted");
        }
        return new StageOutcome.Report("gate passed for " + context.taskId());
    }

    public boolean awaitEntered() throws InterruptedException {
        return entered.await(5, TimeUnit.SECONDS);
    }

    public void release() {
        release.countDown();
    }
}
