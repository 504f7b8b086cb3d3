package com.tunechat.match.semantic;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "match.semantic")
public class SemanticSearchProperties {
    private int k = 50;
    private int overfetchFactor = 2;
    private double similarityThreshold = 0.0;
    private boolean preciseRerank = false;
    private int rerankWindow = 20;
    private int resultLimit = 10;
    private Aboutness aboutness = new Aboutness();

    public int getK() {
        return k;
    }

    public void setK(int k) {
        this.k = k;
    }

    public int getOverfetchFactor() {
        return overfetchFactor;
    }

    public void setOverfetchFactor(int overfetchFactor) {
        this.overfetchFactor = overfetchFactor;
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    public void setSimilarityThreshold(double similarityThreshold) {
        this.similarityThreshold = similarityThreshold;
    }

    public boolean isPreciseRerank() {
        return preciseRerank;
    }

    public void setPreciseRerank(boolean preciseRerank) {
        this.preciseRerank = preciseRerank;
    }

    public int getRerankWindow() {
        return rerankWindow;
    }

    public void setRerankWindow(int rerankWindow) {
        this.rerankWindow = rerankWindow;
    }

    public int getResultLimit() {
        return resultLimit;
    }

    public void setResultLimit(int resultLimit) {
        this.resultLimit = resultLimit;
    }

    public Aboutness getAboutness() {
        return aboutness;
    }

    public void setAboutness(Aboutness aboutness) {
        this.aboutness = aboutness;
    }

    public static class Aboutness {
        private boolean enabled = false;
        private int topN = 100;
        private double metaWeight = 0.5;
        private double aboutnessWeight = 0.5;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getTopN() {
            return topN;
        }

        public void setTopN(int topN) {
            this.topN = topN;
        }

        public double getMetaWeight() {
            return metaWeight;
        }

        public void setMetaWeight(double metaWeight) {
            this.metaWeight = metaWeight;
        }

        public double getAboutnessWeight() {
            return aboutnessWeight;
        }

        public void setAboutnessWeight(double aboutnessWeight) {
            this.aboutnessWeight = aboutnessWeight;
        }
    }
}
