package com.starscape.thumbnailer.features.ingestthumbnail.infra.events;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestStreamHandler;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.thumbnailer.ThumbnailerApplication;
import com.starscape.thumbnailer.features.ingestthumbnail.app.ThumbnailIngestionPipeline;
import com.starscape.thumbnailer.features.ingestthumbnail.domain.BatchResult;
import com.starscape.thumbnailer.features.ingestthumbnail.domain.UploadEvent;
import com.starscape.thumbnailer.features.ingestthumbnail.infra.MalformedNotificationException;
import com.starscape.thumbnailer.features.ingestthumbnail.infra.S3NotificationParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ConfigurableApplicationContext;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;

/**
 * AWS Lambda entry point for S3 notifications delivered directly to a function.
 * Reads the notification JSON, runs the ingestion pipeline and writes the {@link BatchResult} as JSON.
 *
 * The Spring context is started on the first invocation and reused by every later one in the same
 * process. Missing configuration fails that first invocation before any event is touched.
 */
public class ThumbnailLambdaHandler implements RequestStreamHandler {
    
    private static final Logger log = LoggerFactory.getLogger(ThumbnailLambdaHandler.class);
    
    private static ConfigurableApplicationContext sharedContext;
    
    private final ThumbnailIngestionPipeline pipeline;
    private final S3NotificationParser parser;
    private final ObjectMapper objectMapper;
    
    public ThumbnailLambdaHandler() {
        this(applicationContext());
    }
    
    ThumbnailLambdaHandler(ApplicationContext context) {
        this(context.getBean(ThumbnailIngestionPipeline.class),
            context.getBean(S3NotificationParser.class),
            context.getBean(ObjectMapper.class));
    }
    
    public ThumbnailLambdaHandler(
            ThumbnailIngestionPipeline pipeline,
            S3NotificationParser parser,
            ObjectMapper objectMapper) {
        this.pipeline = pipeline;
        this.parser = parser;
        this.objectMapper = objectMapper;
    }
    
    @Override
    public void handleRequest(InputStream input, OutputStream output, Context context) throws IOException {
        String requestId = context != null ? context.getAwsRequestId() : null;
        log.info("Lambda invoked: requestId={}", requestId);
        
        List<UploadEvent> batch;
        try {
            batch = parser.parse(input);
        } catch (MalformedNotificationException e) {
            log.error("Failed to parse S3 notification: requestId={}", requestId, e);
            batch = List.of(UploadEvent.unparseable());
        }
        
        BatchResult result = pipeline.process(batch);
        objectMapper.writeValue(output, result);
    }
    
    private static synchronized ConfigurableApplicationContext applicationContext() {
        if (sharedContext == null) {
            sharedContext = new SpringApplicationBuilder(ThumbnailerApplication.class)
                    .web(WebApplicationType.NONE)
                    .properties("spring.cloud.aws.sqs.enabled=false")
                    .run();
        }
        return sharedContext;
    }
}
