package xyz.jphil.profile_resume.model;

/**
 * Link to an online profile, network is LinkedIn, GitHub, Twitter or Website
 */
public record Profile(String network, String url) {

    public Profile {
        network = Fields.text(network);
        url = Fields.text(url);
    }
}
