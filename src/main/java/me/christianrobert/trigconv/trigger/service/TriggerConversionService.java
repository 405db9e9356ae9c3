package me.christianrobert.trigconv.trigger.service;

import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.trigconv.config.service.ConfigService;
import me.christianrobert.trigconv.ir.json.IrJsonWriter;
import me.christianrobert.trigconv.parser.ParseResult;
import me.christianrobert.trigconv.translator.mapping.MappingTableProvider;
import me.christianrobert.trigconv.trigger.model.BatchConversionResult;
import me.christianrobert.trigconv.trigger.model.ConversionResult;
import me.christianrobert.trigconv.trigger.model.TriggerSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Application-facing conversion service. Reads the current configuration and mapping tables
 * for every request and delegates to a {@link TriggerConverter}.
 */
@ApplicationScoped
public class TriggerConversionService {

    private static final Logger log = LoggerFactory.getLogger(TriggerConversionService.class);

    @Inject
    ConfigService configService;

    @Inject
    MappingTableProvider mappingTableProvider;

    private final IrJsonWriter irJsonWriter = new IrJsonWriter();

    public TriggerConversionService() {
    }

    public TriggerConversionService(ConfigService configService, MappingTableProvider mappingTableProvider) {
        this.configService = configService;
        this.mappingTableProvider = mappingTableProvider;
    }

    public ConversionResult convert(TriggerSource source) {
        return newConverter().convert(source.getName(), source.getTriggerText(), source.toExplicitMetadata());
    }

    /**
     * Converts every trigger of the batch. A failed trigger is recorded and the batch continues.
     */
    public BatchConversionResult convertBatch(List<TriggerSource> sources) {
        log.info("Converting batch of {} triggers", sources.size());
        TriggerConverter converter = newConverter();

        List<ConversionResult> results = new ArrayList<>();
        for (TriggerSource source : sources) {
            results.add(converter.convert(source.getName(), source.getTriggerText(), source.toExplicitMetadata()));
        }

        BatchConversionResult batch = new BatchConversionResult(results);
        log.info("Batch finished: {} converted, {} failed", batch.getSuccessCount(), batch.getFailureCount());
        return batch;
    }

    /**
     * Parses a trigger and renders its IR as the JSON document.
     *
     * @throws me.christianrobert.trigconv.core.exception.TriggerConversionException on fatal input errors
     */
    public ObjectNode parseToJson(TriggerSource source) {
        ParseResult parsed = newConverter().parse(source.getTriggerText(), source.toExplicitMetadata());
        log.debug("Parsed trigger {} with {} warnings", source.getName(), parsed.getWarnings().size());
        return irJsonWriter.toJson(parsed.getIr());
    }

    private TriggerConverter newConverter() {
        return new TriggerConverter(configService.getParseLimits(), mappingTableProvider.getTables(),
                configService.getConversionOptions());
    }
}
