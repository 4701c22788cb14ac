package com.lennon.idcard.mojo;

import com.lennon.idcard.cn.UpgradeException;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugins.annotations.Mojo;

@Mojo(name = "upgrade", requiresProject = false)
public class UpgradeMojo extends BaseMojo {

    @Override
    public void execute() throws MojoFailureException {
        initService();

        if (!hasText()) {
            getLog().info("No -Dtext provided, nothing to upgrade.");
            return;
        }
        try {
            String out = service.upgrade(text);
            getLog().info("Upgraded: " + out);
            System.out.println(out);
        } catch (UpgradeException e) {
            throw new MojoFailureException(e.getMessage(), e);
        }
    }
}
