package com.lyshra.open.desk.integration.models.dependency;

import com.lyshra.open.desk.integration.contract.dependency.ILyshraOpenDeskFieldDependencyState;
import lombok.Builder;
import lombok.Data;

import java.util.Optional;

@Data
@Builder
public class LyshraOpenDeskFieldDependencyState implements ILyshraOpenDeskFieldDependencyState {
    private final Boolean hiddenByDependency;
    private final Boolean dynamicallyRequired;
    private final Boolean dynamicallyReadOnly;

    @Override
    public Optional<Boolean> getHiddenByDependency() {
        return Optional.ofNullable(hiddenByDependency);
    }

    @Override
    public Optional<Boolean> getDynamicallyRequired() {
        return Optional.ofNullable(dynamicallyRequired);
    }

    @Override
    public Optional<Boolean> getDynamicallyReadOnly() {
        return Optional.ofNullable(dynamicallyReadOnly);
    }
}
