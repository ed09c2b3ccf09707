package com.scheduler.lifecycle.run;

/**
 * One step of an orchestration run, executed by {@link OrchestrationRunner}.
 */
public interface OrchestrationStep {

    String name();

    /**
     * Runs the step. Any exception fails the whole run with the exception's message.
     */
    void execute(StepContext context) throws Exception;

    static OrchestrationStep of(String name, StepBody body) {
        return new OrchestrationStep() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public void execute(StepContext context) throws Exception {
                body.execute(context);
            }
        };
    }

    @FunctionalInterface
    interface StepBody {
        void execute(StepContext context) throws Exception;
    }
}
