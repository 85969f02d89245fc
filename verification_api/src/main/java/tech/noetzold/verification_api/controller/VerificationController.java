package tech.noetzold.verification_api.controller;

import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import tech.noetzold.verification_api.model.*;
import tech.noetzold.verification_api.repository.VerificationRecordRepository;
import tech.noetzold.verification_api.service.OntologyCatalogService;
import tech.noetzold.verification_api.service.VerificationService;

@RestController
public class VerificationController {

    private final VerificationService service;
    private final OntologyCatalogService catalog;
    private final VerificationRecordRepository recordRepo;

    public VerificationController(VerificationService service,
                                  OntologyCatalogService catalog,
                                  VerificationRecordRepository recordRepo) {
        this.service = service;
        this.catalog = catalog;
        this.recordRepo = recordRepo;
    }

    @PostMapping("/verify")
    public VerifyResponse verify(@Valid @RequestBody VerifyRequest req) {
        return service.verify(req);
    }

    @GetMapping("/verification/{id}")
    public ResponseEntity<VerificationRecordResponse> getRecord(@PathVariable("id") String verificationId) {
        return recordRepo.findByVerificationId(verificationId)
                .map(VerificationRecordResponse::fromEntity)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/ontology/{name}")
    public OntologyResponse getOntology(@PathVariable("name") String name,
                                        @RequestParam(value = "version", required = false) String version) {
        return OntologyResponse.from(service.describe(name, version));
    }

    @GetMapping("/ontologies")
    public OntologyListResponse listOntologies() {
        return catalog.list();
    }

    @PostMapping("/certificate/verify")
    public CertificateCheckResponse checkCertificate(@Valid @RequestBody CertificateCheckRequest req) {
        return service.checkCertificate(req);
    }
}
