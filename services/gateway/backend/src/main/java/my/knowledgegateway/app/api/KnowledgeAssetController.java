package my.knowledgegateway.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import my.knowledgegateway.app.dto.AssetIngestRequest;
import my.knowledgegateway.app.dto.AssetIngestResponseDto;
import my.knowledgegateway.app.dto.AssetSearchResultDto;
import my.knowledgegateway.app.service.AssetIngestService;
import my.knowledgegateway.app.service.AssetRetrieval;
import my.knowledgegateway.app.service.KnowledgeAssetService;
import my.knowledgegateway.app.service.PaymentGate;
import my.knowledgegateway.app.service.ResourceDescriptor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/assets")
@Tag(name = "Knowledge Assets")
public class KnowledgeAssetController {
	private final KnowledgeAssetService knowledgeAssetService;
	private final AssetIngestService assetIngestService;

	public KnowledgeAssetController(KnowledgeAssetService knowledgeAssetService,
									AssetIngestService assetIngestService) {
		this.knowledgeAssetService = knowledgeAssetService;
		this.assetIngestService = assetIngestService;
	}

	@GetMapping("/{topicId}")
	@Operation(summary = "Get the current knowledge asset for a topic",
			description = "Monetized assets answer 402 with an x402 payment challenge until a valid X-PAYMENT proof is sent.")
	public ResponseEntity<?> getAsset(@PathVariable String topicId,
									  @RequestHeader(name = PaymentGate.PAYMENT_HEADER, required = false) String payment,
									  HttpServletRequest request) {
		ResourceDescriptor resource = new ResourceDescriptor(request.getMethod(), request.getRequestURI());
		AssetRetrieval retrieval = knowledgeAssetService.retrieve(topicId, payment, resource);
		if (retrieval.isPaymentRequired()) {
			return ResponseEntity.status(HttpStatus.PAYMENT_REQUIRED).body(retrieval.getChallenge());
		}
		ResponseEntity.BodyBuilder response = ResponseEntity.ok();
		if (retrieval.getPaymentResponseHeader() != null) {
			response.header(PaymentGate.PAYMENT_RESPONSE_HEADER, retrieval.getPaymentResponseHeader());
		}
		return response.body(retrieval.getAsset());
	}

	@GetMapping
	@Operation(summary = "Search knowledge assets by topic or title")
	public AssetSearchResultDto search(@RequestParam(required = false) String keyword,
									   @RequestParam(required = false) Integer limit) {
		return knowledgeAssetService.search(keyword, limit);
	}

	@PostMapping
	@Operation(summary = "Publish an analysis as a knowledge asset")
	public AssetIngestResponseDto ingest(@Valid @RequestBody AssetIngestRequest request) {
		return assetIngestService.ingest(request);
	}
}
