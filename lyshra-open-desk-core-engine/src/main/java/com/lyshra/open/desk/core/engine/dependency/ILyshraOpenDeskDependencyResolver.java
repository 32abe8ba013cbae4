package com.lyshra.open.desk.core.engine.dependency;

import com.lyshra.open.desk.integration.contract.document.ILyshraOpenDeskDocument;
import com.lyshra.open.desk.integration.contract.metadata.ILyshraOpenDeskFieldDefinition;
import com.lyshra.open.desk.integration.models.dependency.LyshraOpenDeskDependencyOverrides;

import java.util.List;

public interface ILyshraOpenDeskDependencyResolver {

    default LyshraOpenDeskDependencyOverrides resolve(List<? extends ILyshraOpenDeskFieldDefinition> fields, ILyshraOpenDeskDocument document) {
        return resolve(fields, document, null);
    }

    /**
     * Evaluates the dependency expressions of every field against the document. Child rows pass
     * their parent document; without one the row is its own parent.
     *
     * @return overrides for the fields declaring at least one expression; empty without a document
     */
    LyshraOpenDeskDependencyOverrides resolve(
            List<? extends ILyshraOpenDeskFieldDefinition> fields,
            ILyshraOpenDeskDocument document,
            ILyshraOpenDeskDocument parent);
}
