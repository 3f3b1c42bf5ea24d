package org.bpmnml.generator;

import org.camunda.bpm.model.bpmn.Bpmn;
import org.camunda.bpm.model.bpmn.BpmnModelInstance;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.nio.charset.StandardCharsets;

/**
 * Checks generated documents against the BPMN 2.0 XML schema through the Camunda model API.
 */
public class BpmnOutputValidator {

    /**
     * Validates generated XML text.
     * Throws an exception if invalid.
     */
    public static BpmnModelInstance validate(String xml) {
        BpmnModelInstance modelInstance = Bpmn.readModelFromStream(
                new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
        Bpmn.validateModel(modelInstance);  // throws exception if invalid
        return modelInstance;
    }

    /**
     * Validates a BPMN file from disk.
     * Throws an exception if invalid.
     */
    public static BpmnModelInstance validate(File bpmnFile) {
        BpmnModelInstance modelInstance = Bpmn.readModelFromFile(bpmnFile);
        Bpmn.validateModel(modelInstance);
        return modelInstance;
    }

    /**
     * Boolean-style validation.
     */
    public static boolean isValid(String xml) {
        try {
            validate(xml);
            return true;
        } catch (Exception e) {
            return false;
        }
    }
}
