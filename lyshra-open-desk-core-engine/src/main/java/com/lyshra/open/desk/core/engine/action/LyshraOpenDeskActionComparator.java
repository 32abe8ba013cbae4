package com.lyshra.open.desk.core.engine.action;

import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskAction;

import java.util.Comparator;

/**
 * Primary actions first, then ascending priority, then label ignoring case.
 * Label and id break the remaining ties so the order is total.
 */
public class LyshraOpenDeskActionComparator implements Comparator<ILyshraOpenDeskAction> {

    private final Comparator<ILyshraOpenDeskAction> delegate;

    public LyshraOpenDeskActionComparator(int defaultPriority) {
        this.delegate = Comparator
                .comparing((ILyshraOpenDeskAction action) -> !action.isPrimary())
                .thenComparingInt(action -> action.getPriority().orElse(defaultPriority))
                .thenComparing(LyshraOpenDeskActionComparator::labelOf, String.CASE_INSENSITIVE_ORDER)
                .thenComparing(LyshraOpenDeskActionComparator::labelOf)
                .thenComparing(action -> action.getId() == null ? "" : action.getId());
    }

    @Override
    public int compare(ILyshraOpenDeskAction first, ILyshraOpenDeskAction second) {
        return delegate.compare(first, second);
    }

    private static String labelOf(ILyshraOpenDeskAction action) {
        return action.getLabel() == null ? "" : action.getLabel();
    }
}
