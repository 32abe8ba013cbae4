package com.lyshra.open.desk.integration.contract.dependency;

import java.util.Optional;

/**
 * Result of evaluating a field's dependency expressions. A flag is present only
 * when the field declares the corresponding expression.
 */
public interface ILyshraOpenDeskFieldDependencyState {
    Optional<Boolean> getHiddenByDependency();
    Optional<Boolean> getDynamicallyRequired();
    Optional<Boolean> getDynamicallyReadOnly();
}
