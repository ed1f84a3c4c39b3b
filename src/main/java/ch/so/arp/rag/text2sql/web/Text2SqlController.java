package ch.so.arp.rag.text2sql.web;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.fasterxml.jackson.databind.ObjectMapper;

import ch.so.arp.rag.text2sql.KnowledgeBaseStats;
import ch.so.arp.rag.text2sql.QueryResult;
import ch.so.arp.rag.text2sql.Text2SqlService;
import ch.so.arp.rag.text2sql.knowledge.BuildReport;
import ch.so.arp.rag.text2sql.knowledge.KnowledgeBaseSnapshotCodec;
import ch.so.arp.rag.text2sql.metadata.TableMetadata;
import ch.so.arp.rag.text2sql.rules.BusinessRule;
import ch.so.arp.rag.text2sql.rules.BusinessRulesDocumentReader;
import ch.so.arp.rag.text2sql.validation.ValidationOutcome;
import jakarta.validation.Valid;

/**
 * REST endpoints of the text-to-SQL service.
 */
@RestController
@RequestMapping(path = "/api", produces = MediaType.APPLICATION_JSON_VALUE)
@Validated
public class Text2SqlController {

    private static final Logger LOGGER = LoggerFactory.getLogger(Text2SqlController.class);

    private final Text2SqlService service;
    private final BusinessRulesDocumentReader rulesReader;

    public Text2SqlController(Text2SqlService service, ObjectMapper objectMapper) {
        this.service = service;
        this.rulesReader = new BusinessRulesDocumentReader(objectMapper);
    }

    @PostMapping(path = "/query", consumes = MediaType.APPLICATION_JSON_VALUE)
    public QueryResult query(@Valid @RequestBody QueryRequest request) {
        return service.query(request.question(), request.showIntermediate());
    }

    @PostMapping(path = "/build")
    public BuildReport build(@RequestBody(required = false) BuildRequest request) {
        boolean force = request != null && request.force();
        List<BusinessRule> rules = request == null || request.rules() == null || request.rules().isNull()
                ? List.of()
                : rulesReader.read(request.rules());
        LOGGER.debug("Build requested (force={}, {} additional rules)", force, rules.size());
        return service.build(force, rules);
    }

    @PostMapping(path = "/validate", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ValidationOutcome validate(@Valid @RequestBody ValidateRequest request) {
        return service.validate(request.sql());
    }

    @GetMapping(path = "/schema")
    public ResponseEntity<List<TableMetadata>> schema(@RequestParam(name = "table", required = false) String table) {
        if (table == null || table.isBlank()) {
            return ResponseEntity.ok(service.describeSchema());
        }
        return service.describeTable(table)
                .map(metadata -> ResponseEntity.ok(List.of(metadata)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping(path = "/business-rules", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<BusinessRule> addBusinessRule(@Valid @RequestBody BusinessRuleRequest request) {
        BusinessRule rule = request.toRule();
        boolean replaced = service.addBusinessRule(rule).isPresent();
        return ResponseEntity.status(replaced ? HttpStatus.OK : HttpStatus.CREATED).body(rule);
    }

    @GetMapping(path = "/knowledge-base/export")
    public KnowledgeBaseSnapshotCodec.Snapshot exportKnowledgeBase() {
        return service.exportKnowledgeBase();
    }

    @PostMapping(path = "/knowledge-base/import", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ImportResponse importKnowledgeBase(@RequestBody KnowledgeBaseSnapshotCodec.Snapshot snapshot) {
        return new ImportResponse(service.importKnowledgeBase(snapshot));
    }

    @GetMapping(path = "/stats")
    public KnowledgeBaseStats stats() {
        return service.stats();
    }

    public record ImportResponse(int imported) {
    }
}
