package com.lyshra.open.desk.core.engine;

import com.lyshra.open.desk.core.engine.action.ILyshraOpenDeskActionInvoker;
import com.lyshra.open.desk.core.engine.action.ILyshraOpenDeskActionManifestBuilder;
import com.lyshra.open.desk.core.engine.action.ILyshraOpenDeskActionRequirementEvaluator;
import com.lyshra.open.desk.core.engine.action.LyshraOpenDeskActionComparator;
import com.lyshra.open.desk.core.engine.action.LyshraOpenDeskActionProviderRegistry;
import com.lyshra.open.desk.core.engine.action.impl.LyshraOpenDeskActionInvokerImpl;
import com.lyshra.open.desk.core.engine.action.impl.LyshraOpenDeskActionManifestBuilderImpl;
import com.lyshra.open.desk.core.engine.action.impl.LyshraOpenDeskActionRequirementEvaluatorImpl;
import com.lyshra.open.desk.core.engine.action.providers.LyshraOpenDeskCoreActionProvider;
import com.lyshra.open.desk.core.engine.action.providers.LyshraOpenDeskDocumentDuplicator;
import com.lyshra.open.desk.core.engine.action.providers.LyshraOpenDeskWorkflowActionProvider;
import com.lyshra.open.desk.core.engine.config.LyshraOpenDeskEngineConfig;
import com.lyshra.open.desk.core.engine.config.LyshraOpenDeskEngineConfigLoader;
import com.lyshra.open.desk.core.engine.dependency.ILyshraOpenDeskDependencyResolver;
import com.lyshra.open.desk.core.engine.dependency.impl.LyshraOpenDeskDependencyResolverImpl;
import com.lyshra.open.desk.core.engine.diagnostics.LyshraOpenDeskLoggingDiagnostics;
import com.lyshra.open.desk.core.engine.expression.ILyshraOpenDeskExpressionEvaluator;
import com.lyshra.open.desk.core.engine.expression.LyshraOpenDeskExpressionEvaluator;
import com.lyshra.open.desk.core.engine.field.ILyshraOpenDeskFieldStatusCompiler;
import com.lyshra.open.desk.core.engine.field.ILyshraOpenDeskFormStateCompiler;
import com.lyshra.open.desk.core.engine.field.impl.LyshraOpenDeskFieldStatusCompilerImpl;
import com.lyshra.open.desk.core.engine.field.impl.LyshraOpenDeskFormStateCompilerImpl;
import com.lyshra.open.desk.core.engine.message.ILyshraOpenDeskMessageSource;
import com.lyshra.open.desk.core.engine.message.LyshraOpenDeskMessageSource;
import com.lyshra.open.desk.core.engine.metadata.LyshraOpenDeskMetadataReader;
import com.lyshra.open.desk.core.engine.misc.LyshraOpenDeskObjectMapper;
import com.lyshra.open.desk.core.engine.permission.ILyshraOpenDeskPermissionResolver;
import com.lyshra.open.desk.core.engine.permission.impl.LyshraOpenDeskPermissionResolverImpl;
import com.lyshra.open.desk.core.engine.plugin.ILyshraOpenDeskPluginLoader;
import com.lyshra.open.desk.core.engine.plugin.impl.LyshraOpenDeskPluginLoader;
import com.lyshra.open.desk.core.engine.validation.ILyshraOpenDeskValidationEngine;
import com.lyshra.open.desk.core.engine.validation.ILyshraOpenDeskValidationSummaryFormatter;
import com.lyshra.open.desk.core.engine.validation.impl.LyshraOpenDeskValidationEngineImpl;
import com.lyshra.open.desk.core.engine.validation.impl.LyshraOpenDeskValidationSummaryFormatterImpl;
import com.lyshra.open.desk.integration.contract.ILyshraOpenDeskDiagnostics;
import com.lyshra.open.desk.integration.contract.ILyshraOpenDeskEngineSettings;
import com.lyshra.open.desk.integration.contract.ILyshraOpenDeskObjectMapper;
import lombok.extern.slf4j.Slf4j;

/**
 * Wires the engine services. {@link #getInstance()} uses the class path configuration and logging
 * diagnostics; {@link #create} builds an independent instance for other settings.
 */
@Slf4j
public class LyshraOpenDeskFacade implements ILyshraOpenDeskFacade {

    private final ILyshraOpenDeskEngineSettings engineSettings;
    private final ILyshraOpenDeskDiagnostics diagnostics;
    private final ILyshraOpenDeskMessageSource messageSource;
    private final ILyshraOpenDeskExpressionEvaluator expressionEvaluator;
    private final ILyshraOpenDeskDependencyResolver dependencyResolver;
    private final ILyshraOpenDeskPermissionResolver permissionResolver;
    private final ILyshraOpenDeskFieldStatusCompiler fieldStatusCompiler;
    private final ILyshraOpenDeskFormStateCompiler formStateCompiler;
    private final ILyshraOpenDeskValidationEngine validationEngine;
    private final ILyshraOpenDeskValidationSummaryFormatter validationSummaryFormatter;
    private final ILyshraOpenDeskActionRequirementEvaluator actionRequirementEvaluator;
    private final ILyshraOpenDeskActionInvoker actionInvoker;
    private final LyshraOpenDeskDocumentDuplicator documentDuplicator;
    private final ILyshraOpenDeskPluginLoader pluginLoader;
    private final LyshraOpenDeskMetadataReader metadataReader;

    private LyshraOpenDeskFacade(ILyshraOpenDeskEngineSettings engineSettings, ILyshraOpenDeskDiagnostics diagnostics) {
        this.engineSettings = engineSettings;
        this.diagnostics = diagnostics;
        this.messageSource = new LyshraOpenDeskMessageSource();
        this.expressionEvaluator = new LyshraOpenDeskExpressionEvaluator(engineSettings, diagnostics);
        this.dependencyResolver = new LyshraOpenDeskDependencyResolverImpl(expressionEvaluator);
        this.permissionResolver = new LyshraOpenDeskPermissionResolverImpl(engineSettings);
        this.fieldStatusCompiler = new LyshraOpenDeskFieldStatusCompilerImpl();
        this.formStateCompiler = new LyshraOpenDeskFormStateCompilerImpl(permissionResolver, dependencyResolver, fieldStatusCompiler);
        this.validationEngine = new LyshraOpenDeskValidationEngineImpl(dependencyResolver, messageSource);
        this.validationSummaryFormatter = new LyshraOpenDeskValidationSummaryFormatterImpl(messageSource);
        this.actionRequirementEvaluator = new LyshraOpenDeskActionRequirementEvaluatorImpl(permissionResolver, diagnostics);
        this.actionInvoker = new LyshraOpenDeskActionInvokerImpl(messageSource);
        this.documentDuplicator = new LyshraOpenDeskDocumentDuplicator(messageSource);
        this.pluginLoader = new LyshraOpenDeskPluginLoader(this);
        this.metadataReader = new LyshraOpenDeskMetadataReader(getObjectMapper());
    }

    private static final class SingletonHelper {
        private static final ILyshraOpenDeskFacade INSTANCE = new LyshraOpenDeskFacade(
                new LyshraOpenDeskEngineConfigLoader().load(),
                LyshraOpenDeskLoggingDiagnostics.getInstance());
    }

    public static ILyshraOpenDeskFacade getInstance() {
        return SingletonHelper.INSTANCE;
    }

    public static ILyshraOpenDeskFacade create(ILyshraOpenDeskEngineSettings engineSettings, ILyshraOpenDeskDiagnostics diagnostics) {
        return new LyshraOpenDeskFacade(
                engineSettings == null ? LyshraOpenDeskEngineConfig.defaults() : engineSettings,
                diagnostics == null ? LyshraOpenDeskLoggingDiagnostics.getInstance() : diagnostics);
    }

    @Override
    public LyshraOpenDeskActionProviderRegistry createActionProviderRegistry() {
        LyshraOpenDeskActionProviderRegistry registry = new LyshraOpenDeskActionProviderRegistry()
                .register(new LyshraOpenDeskCoreActionProvider(messageSource, documentDuplicator))
                .register(new LyshraOpenDeskWorkflowActionProvider());
        pluginLoader.loadClasspathPlugins();
        pluginLoader.getLoadedPlugins().forEach(plugin -> registry.registerAll(plugin.getProviders()));
        log.info("Action provider registry created with [{}] providers", registry.size());
        return registry;
    }

    @Override
    public ILyshraOpenDeskActionManifestBuilder createManifestBuilder(LyshraOpenDeskActionProviderRegistry registry) {
        return new LyshraOpenDeskActionManifestBuilderImpl(
                registry,
                actionRequirementEvaluator,
                new LyshraOpenDeskActionComparator(engineSettings.getDefaultActionPriority()),
                diagnostics);
    }

    @Override
    public ILyshraOpenDeskEngineSettings getEngineSettings() {
        return engineSettings;
    }

    @Override
    public ILyshraOpenDeskDiagnostics getDiagnostics() {
        return diagnostics;
    }

    @Override
    public ILyshraOpenDeskObjectMapper getObjectMapper() {
        return LyshraOpenDeskObjectMapper.getInstance();
    }

    @Override
    public ILyshraOpenDeskMessageSource getMessageSource() {
        return messageSource;
    }

    @Override
    public ILyshraOpenDeskExpressionEvaluator getExpressionEvaluator() {
        return expressionEvaluator;
    }

    @Override
    public ILyshraOpenDeskDependencyResolver getDependencyResolver() {
        return dependencyResolver;
    }

    @Override
    public ILyshraOpenDeskPermissionResolver getPermissionResolver() {
        return permissionResolver;
    }

    @Override
    public ILyshraOpenDeskFieldStatusCompiler getFieldStatusCompiler() {
        return fieldStatusCompiler;
    }

    @Override
    public ILyshraOpenDeskFormStateCompiler getFormStateCompiler() {
        return formStateCompiler;
    }

    @Override
    public ILyshraOpenDeskValidationEngine getValidationEngine() {
        return validationEngine;
    }

    @Override
    public ILyshraOpenDeskValidationSummaryFormatter getValidationSummaryFormatter() {
        return validationSummaryFormatter;
    }

    @Override
    public ILyshraOpenDeskActionRequirementEvaluator getActionRequirementEvaluator() {
        return actionRequirementEvaluator;
    }

    @Override
    public ILyshraOpenDeskActionInvoker getActionInvoker() {
        return actionInvoker;
    }

    @Override
    public ILyshraOpenDeskPluginLoader getPluginLoader() {
        return pluginLoader;
    }

    @Override
    public LyshraOpenDeskMetadataReader getMetadataReader() {
        return metadataReader;
    }
}
