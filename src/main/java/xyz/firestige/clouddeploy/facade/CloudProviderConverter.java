package xyz.firestige.clouddeploy.facade;

import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.TypeConversionException;
import xyz.firestige.clouddeploy.domain.config.CloudProvider;

/**
 * --cloud 取值转换，接受 aws / azure / gcp（不区分大小写）
 */
public class CloudProviderConverter implements ITypeConverter<CloudProvider> {

    @Override
    public CloudProvider convert(String value) {
        try {
            return CloudProvider.fromId(value);
        } catch (IllegalArgumentException e) {
            throw new TypeConversionException("'" + value + "' is not a supported provider (aws, azure, gcp)");
        }
    }
}
