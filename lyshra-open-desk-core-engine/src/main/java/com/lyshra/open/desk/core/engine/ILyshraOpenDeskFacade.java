package com.lyshra.open.desk.core.engine;

import com.lyshra.open.desk.core.engine.action.ILyshraOpenDeskActionInvoker;
import com.lyshra.open.desk.core.engine.action.ILyshraOpenDeskActionManifestBuilder;
import com.lyshra.open.desk.core.engine.action.ILyshraOpenDeskActionRequirementEvaluator;
import com.lyshra.open.desk.core.engine.action.LyshraOpenDeskActionProviderRegistry;
import com.lyshra.open.desk.core.engine.dependency.ILyshraOpenDeskDependencyResolver;
import com.lyshra.open.desk.core.engine.expression.ILyshraOpenDeskExpressionEvaluator;
import com.lyshra.open.desk.core.engine.field.ILyshraOpenDeskFieldStatusCompiler;
import com.lyshra.open.desk.core.engine.field.ILyshraOpenDeskFormStateCompiler;
import com.lyshra.open.desk.core.engine.message.ILyshraOpenDeskMessageSource;
import com.lyshra.open.desk.core.engine.metadata.LyshraOpenDeskMetadataReader;
import com.lyshra.open.desk.core.engine.permission.ILyshraOpenDeskPermissionResolver;
import com.lyshra.open.desk.core.engine.plugin.ILyshraOpenDeskPluginLoader;
import com.lyshra.open.desk.core.engine.validation.ILyshraOpenDeskValidationEngine;
import com.lyshra.open.desk.core.engine.validation.ILyshraOpenDeskValidationSummaryFormatter;
import com.lyshra.open.desk.integration.contract.ILyshraOpenDeskPluginFacade;

public interface ILyshraOpenDeskFacade extends ILyshraOpenDeskPluginFacade {
    ILyshraOpenDeskMessageSource getMessageSource();
    ILyshraOpenDeskExpressionEvaluator getExpressionEvaluator();
    ILyshraOpenDeskDependencyResolver getDependencyResolver();
    ILyshraOpenDeskPermissionResolver getPermissionResolver();
    ILyshraOpenDeskFieldStatusCompiler getFieldStatusCompiler();
    ILyshraOpenDeskFormStateCompiler getFormStateCompiler();
    ILyshraOpenDeskValidationEngine getValidationEngine();
    ILyshraOpenDeskValidationSummaryFormatter getValidationSummaryFormatter();
    ILyshraOpenDeskActionRequirementEvaluator getActionRequirementEvaluator();
    ILyshraOpenDeskActionInvoker getActionInvoker();
    ILyshraOpenDeskPluginLoader getPluginLoader();
    LyshraOpenDeskMetadataReader getMetadataReader();

    /**
     * A new registry holding the core providers, the workflow provider and the providers of every
     * loaded plugin, in that order. Class path plugins are discovered on first use.
     */
    LyshraOpenDeskActionProviderRegistry createActionProviderRegistry();

    ILyshraOpenDeskActionManifestBuilder createManifestBuilder(LyshraOpenDeskActionProviderRegistry registry);
}
