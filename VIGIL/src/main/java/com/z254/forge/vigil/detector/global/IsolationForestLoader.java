package com.z254.forge.vigil.detector.global;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.forge.vigil.detector.ModelLoadException;
import com.z254.forge.vigil.domain.model.SensorFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and validates an {@link IsolationForestArtifact}.
 */
@Slf4j
public class IsolationForestLoader {

    private final ObjectMapper objectMapper;

    public IsolationForestLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Load the forest at {@code location}.
     *
     * @throws ModelLoadException if the file is missing, unparseable, structurally invalid
     *                            or declares a feature order other than {@link SensorFeature}
     */
    public IsolationForestModel load(Resource location) throws ModelLoadException {
        IsolationForestArtifact artifact;
        try (InputStream in = location.getInputStream()) {
            artifact = objectMapper.readValue(in, IsolationForestArtifact.class);
        } catch (IOException e) {
            throw new ModelLoadException("Cannot read isolation forest from "
                    + location.getDescription() + ": " + e.getMessage(), e);
        }

        try {
            SensorFeature.verifyContract(artifact.getFeatures());
        } catch (IllegalStateException e) {
            throw new ModelLoadException(e.getMessage(), e);
        }
        if (artifact.getMaxSamples() <= 0) {
            throw new ModelLoadException("Isolation forest max_samples must be positive");
        }
        if (artifact.getTrees().isEmpty()) {
            throw new ModelLoadException("Isolation forest has no trees");
        }

        List<IsolationForestModel.IsolationTree> trees = new ArrayList<>(artifact.getTrees().size());
        for (int t = 0; t < artifact.getTrees().size(); t++) {
            trees.add(toTree(t, artifact.getTrees().get(t)));
        }

        IsolationForestModel model = new IsolationForestModel(artifact.getModelVersion(), trees,
                artifact.getMaxSamples(), artifact.getOffset());
        log.info("Isolation forest loaded from {}: version={}, trees={}, maxSamples={}, offset={}",
                location.getDescription(), artifact.getModelVersion(), trees.size(),
                artifact.getMaxSamples(), artifact.getOffset());
        return model;
    }

    private IsolationForestModel.IsolationTree toTree(int treeIndex, IsolationForestArtifact.Tree tree)
            throws ModelLoadException {
        List<IsolationForestArtifact.Node> nodes = tree.getNodes();
        int size = nodes.size();
        if (size == 0) {
            throw new ModelLoadException("Tree " + treeIndex + " has no nodes");
        }

        int[] feature = new int[size];
        double[] threshold = new double[size];
        int[] left = new int[size];
        int[] right = new int[size];
        int[] samples = new int[size];

        for (int i = 0; i < size; i++) {
            IsolationForestArtifact.Node node = nodes.get(i);
            if (node.isLeaf()) {
                if (node.getSamples() == null || node.getSamples() < 1) {
                    throw new ModelLoadException("Tree " + treeIndex + " leaf " + i + " has no sample count");
                }
                feature[i] = -1;
                samples[i] = node.getSamples();
                continue;
            }
            if (node.getFeature() >= SensorFeature.WIDTH || node.getThreshold() == null
                    || !isChild(node.getLeft(), i, size) || !isChild(node.getRight(), i, size)) {
                throw new ModelLoadException("Tree " + treeIndex + " node " + i + " is not a valid split");
            }
            feature[i] = node.getFeature();
            threshold[i] = node.getThreshold();
            left[i] = node.getLeft();
            right[i] = node.getRight();
        }
        return new IsolationForestModel.IsolationTree(feature, threshold, left, right, samples);
    }

    // Children always follow their parent, which also rules out cycles.
    private boolean isChild(Integer child, int parent, int size) {
        return child != null && child > parent && child < size;
    }
}
