package com.lyshra.open.desk.integration.models.action;

import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskAction;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionConfirmation;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionExecutor;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionRequirement;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskActionGroup;
import lombok.Data;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

@Data
public class LyshraOpenDeskAction implements ILyshraOpenDeskAction {
    private final String id;
    private final String label;
    private final LyshraOpenDeskActionGroup group;
    private final String icon;
    private final Integer priority;
    private final boolean primary;
    private final boolean showAsMenuItem;
    private final List<ILyshraOpenDeskActionRequirement> requirements;
    private final ILyshraOpenDeskActionConfirmation confirmation;
    private final ILyshraOpenDeskActionExecutor executor;

    @Override
    public Optional<String> getIcon() {
        return Optional.ofNullable(icon);
    }

    @Override
    public Optional<Integer> getPriority() {
        return Optional.ofNullable(priority);
    }

    @Override
    public Optional<ILyshraOpenDeskActionConfirmation> getConfirmation() {
        return Optional.ofNullable(confirmation);
    }

    // ---------------------------------------------------------
    // Guided Builder: id, label, group, optional settings, executor
    // ---------------------------------------------------------

    public static InitialStepBuilder builder() { return new Builder(); }

    public interface InitialStepBuilder { LabelStep id(String id); }
    public interface LabelStep { GroupStep label(String label); }
    public interface GroupStep { OptionsStep group(LyshraOpenDeskActionGroup group); }
    public interface OptionsStep extends ExecutorStep {
        OptionsStep icon(String icon);
        OptionsStep priority(int priority);
        OptionsStep primary();
        OptionsStep showAsMenuItem();
        OptionsStep requires(ILyshraOpenDeskActionRequirement... requirements);
        OptionsStep confirm(ILyshraOpenDeskActionConfirmation confirmation);
        OptionsStep confirm(Function<LyshraOpenDeskActionConfirmation.LyshraOpenDeskActionConfirmationBuilder, LyshraOpenDeskActionConfirmation.LyshraOpenDeskActionConfirmationBuilder> builderFn);
    }
    public interface ExecutorStep { BuildStep executor(ILyshraOpenDeskActionExecutor executor); }
    public interface BuildStep { LyshraOpenDeskAction build(); }

    private static class Builder implements InitialStepBuilder, LabelStep, GroupStep, OptionsStep, BuildStep {
        private String id;
        private String label;
        private LyshraOpenDeskActionGroup group;
        private String icon;
        private Integer priority;
        private boolean primary;
        private boolean showAsMenuItem;
        private final List<ILyshraOpenDeskActionRequirement> requirements = new ArrayList<>();
        private ILyshraOpenDeskActionConfirmation confirmation;
        private ILyshraOpenDeskActionExecutor executor;

        @Override
        public LabelStep id(String id) { this.id = id; return this; }

        @Override
        public GroupStep label(String label) { this.label = label; return this; }

        @Override
        public OptionsStep group(LyshraOpenDeskActionGroup group) { this.group = group; return this; }

        @Override
        public OptionsStep icon(String icon) { this.icon = icon; return this; }

        @Override
        public OptionsStep priority(int priority) { this.priority = priority; return this; }

        @Override
        public OptionsStep primary() { this.primary = true; return this; }

        @Override
        public OptionsStep showAsMenuItem() { this.showAsMenuItem = true; return this; }

        @Override
        public OptionsStep requires(ILyshraOpenDeskActionRequirement... requirements) {
            this.requirements.addAll(Arrays.asList(requirements));
            return this;
        }

        @Override
        public OptionsStep confirm(ILyshraOpenDeskActionConfirmation confirmation) {
            this.confirmation = confirmation;
            return this;
        }

        @Override
        public OptionsStep confirm(Function<LyshraOpenDeskActionConfirmation.LyshraOpenDeskActionConfirmationBuilder, LyshraOpenDeskActionConfirmation.LyshraOpenDeskActionConfirmationBuilder> builderFn) {
            this.confirmation = builderFn.apply(LyshraOpenDeskActionConfirmation.builder()).build();
            return this;
        }

        @Override
        public BuildStep executor(ILyshraOpenDeskActionExecutor executor) {
            this.executor = executor;
            return this;
        }

        @Override
        public LyshraOpenDeskAction build() {
            return new LyshraOpenDeskAction(
                    id,
                    label,
                    group,
                    icon,
                    priority,
                    primary,
                    showAsMenuItem,
                    Collections.unmodifiableList(new ArrayList<>(requirements)),
                    confirmation,
                    executor);
        }
    }
}
